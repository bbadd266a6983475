package dev.onboarding.model;

import java.util.List;

/**
 * Merged output of a fully successful analysis.
 */
public record AnalysisResult(
    String subjectId,
    InsightPayload insight,
    List<Trait> traits
) {
    public AnalysisResult {
        traits = List.copyOf(traits);
    }
}
