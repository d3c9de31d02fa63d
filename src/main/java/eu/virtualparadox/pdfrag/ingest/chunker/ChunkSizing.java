package eu.virtualparadox.pdfrag.ingest.chunker;

/**
 * Token budget of a chunking run.
 *
 * @param targetTokens  size above which a chunk is closed (must be {@code > 0})
 * @param overlapTokens maximum size of the suffix carried into the next chunk
 *                      (must be {@code >= 0} and {@code < targetTokens})
 * @param minTokens     size a chunk must reach before it may be closed, except at the end of the text
 *                      (must be {@code >= 0} and {@code <= targetTokens})
 */
public record ChunkSizing(int targetTokens, int overlapTokens, int minTokens) {

    public ChunkSizing {
        if (targetTokens <= 0) {
            throw new IllegalArgumentException("targetTokens must be positive");
        }
        if (overlapTokens < 0 || overlapTokens >= targetTokens) {
            throw new IllegalArgumentException("overlapTokens must be non-negative and less than targetTokens");
        }
        if (minTokens < 0 || minTokens > targetTokens) {
            throw new IllegalArgumentException("minTokens must be non-negative and not greater than targetTokens");
        }
    }
}
