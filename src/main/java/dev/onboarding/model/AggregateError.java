package dev.onboarding.model;

import java.util.List;

/**
 * Every failure message reported by the tasks of one run, in task order.
 */
public record AggregateError(List<String> messages) {

    public AggregateError {
        messages = List.copyOf(messages);
    }

    @Override
    public String toString() {
        return "Agent errors: " + messages;
    }
}
