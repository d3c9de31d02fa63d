package eu.virtualparadox.pdfrag.rag.retriever;

/**
 * @param chunkId        identifier of the chunk
 * @param chunkText      chunk text
 * @param sourceIdentity identity of the parent document
 * @param ordinal        position of the chunk inside the document, {@code -1} if unknown
 * @param rawDistance    distance reported by the vector backend
 * @param similarity     converted similarity in {@code (0, 1]}
 * @param score          ranking score: the similarity, or the combined score after reranking
 */
public record RetrievedChunk(String chunkId,
                             String chunkText,
                             String sourceIdentity,
                             int ordinal,
                             double rawDistance,
                             double similarity,
                             double score) {

    public RetrievedChunk withScore(final double newScore) {
        return new RetrievedChunk(chunkId, chunkText, sourceIdentity, ordinal, rawDistance, similarity, newScore);
    }
}
