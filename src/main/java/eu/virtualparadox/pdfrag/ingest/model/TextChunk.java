package eu.virtualparadox.pdfrag.ingest.model;

/**
 * Immutable retrieval unit produced by the chunker.
 *
 * @param chunkId    deterministic identifier, see {@link #idOf(String, int)}
 * @param content    chunk text
 * @param metadata   source identity, ordinal, counts and creation time
 * @param tokenCount number of tokens of {@code content} according to the configured token counter
 */
public record TextChunk(String chunkId,
                        String content,
                        ChunkMetadata metadata,
                        int tokenCount) {

    /**
     * Builds a stable chunk identifier:
     * <pre>
     *   {sourceIdentity}_{ordinal(5 digits)}
     * </pre>
     *
     * @param sourceIdentity document identity
     * @param ordinal        zero-based position within the document
     * @return chunk id string
     */
    public static String idOf(final String sourceIdentity, final int ordinal) {
        return sourceIdentity + "_" + String.format("%05d", ordinal);
    }

    public String sourceIdentity() {
        return metadata.sourceIdentity();
    }

    public int ordinal() {
        return metadata.ordinal();
    }
}
