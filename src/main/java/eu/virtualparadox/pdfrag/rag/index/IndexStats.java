package eu.virtualparadox.pdfrag.rag.index;

/**
 * @param count          number of stored records
 * @param backend        backend identity
 * @param embeddingModel embedding model the vectors were produced with
 * @param dimension      vector dimension
 */
public record IndexStats(long count, EIndexBackend backend, String embeddingModel, int dimension) {
}
