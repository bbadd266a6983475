package dev.onboarding.model;

import java.util.List;

/**
 * Trait scores produced by the trait task.
 */
public record TraitPayload(List<Trait> traits) {

    public static final int MAX_TRAITS = 5;

    public TraitPayload {
        traits = List.copyOf(traits);
    }
}
