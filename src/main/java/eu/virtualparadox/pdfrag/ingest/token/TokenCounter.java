package eu.virtualparadox.pdfrag.ingest.token;

/**
 * Counts tokens for chunk size decisions.
 * <p>Implementations must be deterministic and thread-safe.</p>
 */
public interface TokenCounter {

    /**
     * @param text text to measure, {@code null} counts as empty
     * @return number of tokens in {@code text}
     */
    int count(String text);

    /**
     * @return short identifier of the tokenization scheme
     */
    String name();
}
