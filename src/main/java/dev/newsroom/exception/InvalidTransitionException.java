package dev.newsroom.exception;

/**
 * The requested move is not an edge of the workflow graph from the current state.
 */
public class InvalidTransitionException extends RuntimeException {

    public InvalidTransitionException(String message) {
        super(message);
    }

    public InvalidTransitionException(String subject, Object currentState, Object requested) {
        super("%s cannot move from %s via %s".formatted(subject, currentState, requested));
    }
}
