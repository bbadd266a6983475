package dev.onboarding.engine;

import dev.onboarding.model.AggregateError;

import java.util.List;

/**
 * Thrown when an analysis cannot produce a complete, valid result.
 */
public class AnalysisException extends Exception {

    private final List<String> errors;

    public AnalysisException(AggregateError error) {
        this("Agent errors: " + error.messages(), error.messages());
    }

    public AnalysisException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    /** Every underlying failure message, in order. */
    public List<String> errors() {
        return errors;
    }
}
