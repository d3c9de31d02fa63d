package eu.virtualparadox.pdfrag.query;

import eu.virtualparadox.pdfrag.rag.retriever.RetrievedChunk;

/**
 * A chunk that contributed to an answer.
 *
 * @param sourceIdentity document identity
 * @param ordinal        chunk index within the document
 * @param similarity     converted similarity of the chunk
 * @param preview        first characters of the chunk text
 */
public record SourceReference(String sourceIdentity, int ordinal, double similarity, String preview) {

    static final int PREVIEW_LENGTH = 100;

    public static SourceReference of(final RetrievedChunk chunk) {
        final String text = chunk.chunkText();
        final String preview = text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
        return new SourceReference(chunk.sourceIdentity(), chunk.ordinal(), chunk.similarity(), preview);
    }
}
