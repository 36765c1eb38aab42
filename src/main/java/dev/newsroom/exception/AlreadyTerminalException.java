package dev.newsroom.exception;

/**
 * The target is already in a terminal state (task completed or cancelled,
 * story published, translation approved).
 */
public class AlreadyTerminalException extends RuntimeException {

    public AlreadyTerminalException(String resource, Object id, Object state) {
        super("%s %s is already %s".formatted(resource, id, state));
    }
}
