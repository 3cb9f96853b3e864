package dev.sitesage.model;

/**
 * Input rejected before any analysis work starts: malformed URL, empty or oversized batch.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
