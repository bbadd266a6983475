package dev.onboarding.model;

/**
 * A single scored trait. The score is always within [-1.0, 1.0].
 */
public record Trait(
    String name,
    double score,
    String reason
) {
    public static final String UNKNOWN_NAME = "unknown_trait";
    public static final double MIN_SCORE = -1.0;
    public static final double MAX_SCORE = 1.0;

    public Trait {
        score = clampScore(score);
    }

    public static double clampScore(double score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
