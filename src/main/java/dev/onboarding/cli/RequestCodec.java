package dev.onboarding.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.onboarding.model.AnalysisInput;
import dev.onboarding.model.AnalysisResult;
import dev.onboarding.model.Trait;

/**
 * Maps the CLI's JSON request and response documents to and from the analysis model.
 *
 * <p>Request: {@code {"user_id": ..., "question": ..., "answer": ...}}.
 * Response: {@code {"user_id": ..., "insight": {"summary", "keywords"}, "traits": [{"name", "score", "reason"}]}}.
 */
public final class RequestCodec {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private RequestCodec() {}

    /**
     * Read a request document. Absent fields map to null and are rejected later by input validation.
     *
     * @throws IllegalArgumentException if the document is not an object or a field is not a string
     */
    public static AnalysisInput readRequest(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Invalid input: request must be a JSON object");
        }
        return new AnalysisInput(
            stringField(root, "user_id"),
            stringField(root, "question"),
            stringField(root, "answer")
        );
    }

    public static ObjectNode toJson(AnalysisResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("user_id", result.subjectId());

        ObjectNode insight = root.putObject("insight");
        insight.put("summary", result.insight().summary());
        ArrayNode keywords = insight.putArray("keywords");
        result.insight().keywords().forEach(keywords::add);

        ArrayNode traits = root.putArray("traits");
        for (Trait trait : result.traits()) {
            traits.addObject()
                .put("name", trait.name())
                .put("score", trait.score())
                .put("reason", trait.reason());
        }
        return root;
    }

    /**
     * Render a result as indented JSON.
     */
    public static String writeResult(AnalysisResult result) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(result));
    }

    private static String stringField(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException("Invalid input: field '%s' must be a string".formatted(field));
        }
        return value.asText();
    }
}
