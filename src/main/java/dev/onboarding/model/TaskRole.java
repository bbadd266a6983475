package dev.onboarding.model;

/**
 * The slot of {@link AnalysisResult} a task's payload is merged into.
 */
public enum TaskRole {
    INSIGHT,
    TRAITS
}
