package dev.onboarding.engine;

/**
 * Thrown when a backend reply cannot be interpreted as the structured shape a task expects.
 */
public class ReplyShapeException extends Exception {

    public ReplyShapeException(String message) {
        super(message);
    }

    public ReplyShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
