package dev.onboarding.model;

/**
 * Terminal result of a single analysis task.
 */
public sealed interface TaskOutcome<P> {

    record Success<P>(P payload) implements TaskOutcome<P> {}

    record Failure<P>(String message) implements TaskOutcome<P> {}

    static <P> TaskOutcome<P> success(P payload) {
        return new Success<>(payload);
    }

    static <P> TaskOutcome<P> failure(String message) {
        return new Failure<>(message);
    }
}
