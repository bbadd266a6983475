package dev.onboarding.backend;

/**
 * Abstraction over text-generation services (OpenAI-compatible chat endpoints, stubs in tests).
 */
@FunctionalInterface
public interface TextBackend {

    int DEFAULT_MAX_TOKENS = 400;

    /**
     * Send a system instruction and user content to the model and return the raw reply text.
     *
     * @param systemInstruction instructions describing the role and the reply format
     * @param userContent       the content to analyze
     * @param maxTokens         upper bound on generated tokens
     * @return the reply text, never null
     * @throws BackendException if the service cannot be reached or reports a failure
     */
    String invoke(String systemInstruction, String userContent, int maxTokens) throws BackendException;

    default String invoke(String systemInstruction, String userContent) throws BackendException {
        return invoke(systemInstruction, userContent, DEFAULT_MAX_TOKENS);
    }

    /** Get backend display name. */
    default String getName() {
        return getClass().getSimpleName();
    }
}
