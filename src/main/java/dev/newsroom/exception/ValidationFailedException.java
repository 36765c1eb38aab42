package dev.newsroom.exception;

/**
 * A required input (rejection reason, translation body, target language) was missing or invalid.
 */
public class ValidationFailedException extends RuntimeException {

    private final String field;

    public ValidationFailedException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
