package dev.newsroom.exception;

/**
 * The state read at the start of an operation changed before its write landed.
 * Callers may re-read and retry.
 */
public class StaleStateException extends RuntimeException {

    public StaleStateException(String message) {
        super(message);
    }

    public StaleStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
