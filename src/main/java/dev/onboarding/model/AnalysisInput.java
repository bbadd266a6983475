package dev.onboarding.model;

/**
 * One onboarding question and the user's free-text answer, shared read-only by every task.
 */
public record AnalysisInput(
    String subjectId,
    String promptText,
    String responseText
) {}
