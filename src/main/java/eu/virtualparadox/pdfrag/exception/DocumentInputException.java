package eu.virtualparadox.pdfrag.exception;

/**
 * Rejected input: missing or unreadable file, wrong type, oversized file, empty text,
 * blank query or a non-positive result count. Always raised before any store is touched.
 */
public class DocumentInputException extends IllegalArgumentException {

    public DocumentInputException(final String message) {
        super(message);
    }

    public DocumentInputException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
