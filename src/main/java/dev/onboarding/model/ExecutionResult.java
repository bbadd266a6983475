package dev.onboarding.model;

/**
 * Outcome of one executor run: either a merged result or the aggregated task failures.
 */
public sealed interface ExecutionResult {

    record Completed(AnalysisResult result) implements ExecutionResult {}

    record Failed(AggregateError error) implements ExecutionResult {}
}
