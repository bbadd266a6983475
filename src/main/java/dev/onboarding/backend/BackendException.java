package dev.onboarding.backend;

/**
 * Thrown when the text-generation service could not be reached or returned a transport-level failure.
 */
public class BackendException extends Exception {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
