package eu.virtualparadox.pdfrag.rag.retriever;

/**
 * Converts a backend distance into a bounded similarity.
 * <p>Implementations must be monotonically decreasing in {@code |distance|} and map every finite
 * distance into {@code (0, 1]}.</p>
 */
@FunctionalInterface
public interface SimilarityConverter {

    double toSimilarity(double rawDistance);
}
