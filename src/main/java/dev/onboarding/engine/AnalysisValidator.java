package dev.onboarding.engine;

import dev.onboarding.model.AnalysisInput;
import dev.onboarding.model.AnalysisResult;
import dev.onboarding.model.InsightPayload;
import dev.onboarding.model.Trait;
import dev.onboarding.model.TraitPayload;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks requests before analysis and merged results after it. Each method returns an empty list
 * if valid, or every violation found.
 */
public final class AnalysisValidator {

    public static final int MIN_KEYWORDS = 2;
    public static final int MIN_TRAITS = 2;

    private AnalysisValidator() {}

    public static List<String> validateInput(AnalysisInput input) {
        var errors = new ArrayList<String>();
        requireText(errors, "user_id", input.subjectId());
        requireText(errors, "question", input.promptText());
        requireText(errors, "answer", input.responseText());
        return errors;
    }

    public static List<String> validateResult(AnalysisResult result) {
        var errors = new ArrayList<String>();

        int keywords = result.insight().keywords().size();
        if (keywords < MIN_KEYWORDS || keywords > InsightPayload.MAX_KEYWORDS) {
            errors.add("insight.keywords must contain %d-%d entries, got %d"
                .formatted(MIN_KEYWORDS, InsightPayload.MAX_KEYWORDS, keywords));
        }

        int traits = result.traits().size();
        if (traits < MIN_TRAITS || traits > TraitPayload.MAX_TRAITS) {
            errors.add("traits must contain %d-%d entries, got %d"
                .formatted(MIN_TRAITS, TraitPayload.MAX_TRAITS, traits));
        }

        for (Trait trait : result.traits()) {
            if (trait.score() < Trait.MIN_SCORE || trait.score() > Trait.MAX_SCORE) {
                errors.add("Trait '%s' has score %s outside [-1.0, 1.0]".formatted(trait.name(), trait.score()));
            }
        }
        return errors;
    }

    private static void requireText(List<String> errors, String field, String value) {
        if (value == null || value.isBlank()) {
            errors.add("Field '%s' is required and must not be empty".formatted(field));
        }
    }
}
