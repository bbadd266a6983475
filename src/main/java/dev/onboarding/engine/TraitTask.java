package dev.onboarding.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.onboarding.backend.TextBackend;
import dev.onboarding.model.TaskRole;
import dev.onboarding.model.Trait;
import dev.onboarding.model.TraitPayload;

import java.util.ArrayList;

/**
 * Scores two to five dating-relevant traits, each with a one-sentence reason.
 * Missing names and reasons are defaulted rather than failing the task.
 */
public final class TraitTask extends AbstractAnalysisTask<TraitPayload> {

    public static final String NAME = "TraitAgent";

    static final int MAX_TOKENS = 400;

    static final String SYSTEM_INSTRUCTION = """
        You are a TraitAgent for a dating app's onboarding system.

        Your job is to analyze a user's response and score 2-3 personality/dating traits.
        Each trait should have:
        - A snake_case name (e.g., relationship_goal_readiness, social_energy, openness_to_commitment)
        - A numeric score from -1.0 to 1.0 where:
          - -1.0 = strongly negative/low
          - 0.0 = neutral/ambiguous
          - 1.0 = strongly positive/high
        - A one-sentence reasoning explaining the score

        Consider traits relevant to dating like:
        - relationship_goal_readiness: How clear and ready are they for their stated goals?
        - openness_to_commitment: How willing are they to commit?
        - social_energy: Introvert (-1) to extrovert (1)
        - emotional_availability: How emotionally open do they seem?
        - self_awareness: How self-aware do they appear about their needs?

        Pick 2-3 traits that are MOST RELEVANT to what the user said.

        You MUST respond with valid JSON in this exact format:
        {
          "traits": [
            {"name": "trait_name", "score": 0.8, "reason": "One sentence explanation"},
            {"name": "another_trait", "score": 0.5, "reason": "One sentence explanation"}
          ]
        }

        Only output the JSON, nothing else.""";

    static final String CLOSING_INSTRUCTION =
        "Analyze this response and score relevant personality/dating traits.";

    public TraitTask(TextBackend backend) {
        super(backend);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TaskRole role() {
        return TaskRole.TRAITS;
    }

    @Override
    protected String systemInstruction() {
        return SYSTEM_INSTRUCTION;
    }

    @Override
    protected String closingInstruction() {
        return CLOSING_INSTRUCTION;
    }

    @Override
    protected int maxTokens() {
        return MAX_TOKENS;
    }

    @Override
    protected TraitPayload parsePayload(JsonNode reply) throws ReplyShapeException {
        var traits = new ArrayList<Trait>();
        for (JsonNode node : ReplyParser.truncate(ReplyParser.arrayOrEmpty(reply, "traits"),
                TraitPayload.MAX_TRAITS)) {
            if (!node.isObject()) {
                throw new ReplyShapeException("Trait entry must be an object but got " + node);
            }
            traits.add(new Trait(
                ReplyParser.textOrDefault(node, "name", Trait.UNKNOWN_NAME),
                parseScore(node.get("score")),
                ReplyParser.textOrDefault(node, "reason", "")
            ));
        }
        return new TraitPayload(traits);
    }

    static double parseScore(JsonNode score) throws ReplyShapeException {
        if (score == null) {
            return 0.0;
        }
        double value;
        if (score.isNumber()) {
            value = score.doubleValue();
        } else if (score.isTextual()) {
            try {
                value = Double.parseDouble(score.asText().trim());
            } catch (NumberFormatException e) {
                throw new ReplyShapeException("Score is not a number: '%s'".formatted(score.asText()), e);
            }
        } else {
            throw new ReplyShapeException("Score is not a number: " + score);
        }
        if (Double.isNaN(value)) {
            throw new ReplyShapeException("Score is not a number: NaN");
        }
        return Trait.clampScore(value);
    }
}
