package eu.virtualparadox.pdfrag.exception;

/**
 * An external backend (embedding provider, vector store) cannot serve the request.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(final String message) {
        super(message);
    }

    public BackendUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
