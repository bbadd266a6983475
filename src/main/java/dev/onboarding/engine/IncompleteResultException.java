package dev.onboarding.engine;

/**
 * Thrown when every task succeeded but a payload required by the merge is missing or of the wrong type.
 * Indicates a misconfigured task set.
 */
public class IncompleteResultException extends RuntimeException {

    public IncompleteResultException(String message) {
        super(message);
    }
}
