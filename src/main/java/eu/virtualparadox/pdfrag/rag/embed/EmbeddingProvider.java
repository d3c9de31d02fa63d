package eu.virtualparadox.pdfrag.rag.embed;

/**
 * Black-box embedding generation: {@code text -> vector}.
 * <p>
 * Implementations may block and may throw on any failure; the {@link EmbeddingGateway} bounds
 * every call and isolates failures per item.
 */
public interface EmbeddingProvider {

    /**
     * Embeds a single text.
     *
     * @param text the text (non-null)
     * @return a dense vector
     * @throws Exception on provider failure
     */
    float[] embed(String text) throws Exception;

    /**
     * @return identity of the underlying model
     */
    String modelName();
}
