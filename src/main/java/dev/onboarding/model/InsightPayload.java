package dev.onboarding.model;

import java.util.List;

/**
 * Summary and key phrases produced by the insight task.
 */
public record InsightPayload(
    String summary,
    List<String> keywords
) {
    public static final int MAX_KEYWORDS = 5;

    public InsightPayload {
        keywords = List.copyOf(keywords);
    }
}
