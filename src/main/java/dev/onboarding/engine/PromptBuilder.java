package dev.onboarding.engine;

import dev.onboarding.model.AnalysisInput;

/**
 * Builds the user content sent alongside each task's system instruction.
 */
public final class PromptBuilder {

    private PromptBuilder() {}

    /**
     * Build the user message for a task: the question, the user's answer, then the task's closing request.
     */
    public static String buildUserContent(AnalysisInput input, String closingInstruction) {
        var sb = new StringBuilder();
        sb.append("Onboarding Question: ").append(input.promptText());
        sb.append("\n\n");
        sb.append("User's Response: ").append(input.responseText());
        sb.append("\n\n");
        sb.append(closingInstruction);
        return sb.toString();
    }
}
