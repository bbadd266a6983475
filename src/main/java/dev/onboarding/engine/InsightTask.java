package dev.onboarding.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.onboarding.backend.TextBackend;
import dev.onboarding.model.InsightPayload;
import dev.onboarding.model.TaskRole;

import java.util.ArrayList;

/**
 * Produces a short friendly summary of the answer and its key phrases.
 */
public final class InsightTask extends AbstractAnalysisTask<InsightPayload> {

    public static final String NAME = "InsightAgent";

    static final int MAX_TOKENS = 300;

    static final String SYSTEM_INSTRUCTION = """
        You are an InsightAgent for a dating app's onboarding system.

        Your job is to analyze a user's response to an onboarding question and produce:
        1. A SHORT, FRIENDLY natural-language summary (1-2 sentences max)
        2. 2-3 key phrases that capture the essence of their response

        Be warm and empathetic. Focus on what the user truly wants.

        You MUST respond with valid JSON in this exact format:
        {
          "summary": "A brief, friendly summary of what the user is looking for",
          "keywords": ["keyword1", "keyword2", "keyword3"]
        }

        Only output the JSON, nothing else.""";

    static final String CLOSING_INSTRUCTION = "Analyze this response and provide a summary with keywords.";

    public InsightTask(TextBackend backend) {
        super(backend);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public TaskRole role() {
        return TaskRole.INSIGHT;
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
    protected InsightPayload parsePayload(JsonNode reply) throws ReplyShapeException {
        String summary = ReplyParser.textOrDefault(reply, "summary", "");

        var keywords = new ArrayList<String>();
        for (JsonNode keyword : ReplyParser.truncate(ReplyParser.arrayOrEmpty(reply, "keywords"),
                InsightPayload.MAX_KEYWORDS)) {
            if (!keyword.isTextual()) {
                throw new ReplyShapeException("Keyword must be a string but got " + keyword);
            }
            keywords.add(keyword.asText());
        }

        return new InsightPayload(summary, keywords);
    }
}
