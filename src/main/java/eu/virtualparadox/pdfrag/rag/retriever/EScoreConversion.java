package eu.virtualparadox.pdfrag.rag.retriever;

/**
 * Built-in distance to similarity conversions. Negative distances (reported by some backends for
 * inner-product spaces) are taken by absolute value.
 */
public enum EScoreConversion implements SimilarityConverter {

    /** {@code 1 / (1 + |d|)} on the raw (squared Euclidean) distance. */
    INVERSE_DISTANCE {
        @Override
        public double toSimilarity(final double rawDistance) {
            return 1.0 / (1.0 + Math.abs(rawDistance));
        }
    },

    /** {@code 1 / (1 + sqrt|d|)}: the same curve on the plain Euclidean distance, less steep for distant matches. */
    INVERSE_ROOT_DISTANCE {
        @Override
        public double toSimilarity(final double rawDistance) {
            return 1.0 / (1.0 + Math.sqrt(Math.abs(rawDistance)));
        }
    }
}
