package eu.virtualparadox.pdfrag.exception;

import java.io.IOException;

/**
 * A bounded backend call timed out, was interrupted, or failed inside the backend.
 */
public class BackendCallException extends IOException {

    public BackendCallException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
