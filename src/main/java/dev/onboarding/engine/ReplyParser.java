package dev.onboarding.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw backend reply text into a JSON object and reads typed fields from it with explicit defaults.
 */
public final class ReplyParser {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    private ReplyParser() {}

    /**
     * Parse the reply as a single JSON object, unwrapping a surrounding markdown code fence if present.
     *
     * @throws ReplyShapeException if the reply is blank, not a single JSON value, or not an object
     */
    public static JsonNode parseObject(String reply) throws ReplyShapeException {
        if (reply == null || reply.isBlank()) {
            throw new ReplyShapeException("Empty reply");
        }

        String candidate = stripFences(reply.trim());

        JsonNode node;
        try {
            node = MAPPER.readTree(candidate);
        } catch (JsonProcessingException e) {
            throw new ReplyShapeException("Invalid JSON: " + e.getOriginalMessage(), e);
        }

        if (node == null || !node.isObject()) {
            JsonNodeType type = node == null ? JsonNodeType.MISSING : node.getNodeType();
            throw new ReplyShapeException("Expected a JSON object but got " + type.name().toLowerCase(Locale.ROOT));
        }
        return node;
    }

    /**
     * Read a string field, returning {@code fallback} when the field is absent. An explicit null is rejected.
     */
    public static String textOrDefault(JsonNode node, String field, String fallback) throws ReplyShapeException {
        JsonNode value = node.get(field);
        if (value == null) {
            return fallback;
        }
        if (!value.isTextual()) {
            throw new ReplyShapeException("Field '%s' must be a string".formatted(field));
        }
        return value.asText();
    }

    /**
     * Read an array field as a list of elements, returning an empty list when the field is absent.
     * An explicit null is rejected.
     */
    public static List<JsonNode> arrayOrEmpty(JsonNode node, String field) throws ReplyShapeException {
        JsonNode value = node.get(field);
        if (value == null) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new ReplyShapeException("Field '%s' must be an array".formatted(field));
        }
        var elements = new ArrayList<JsonNode>(value.size());
        value.forEach(elements::add);
        return elements;
    }

    /**
     * Keep the first {@code max} elements of {@code list}, preserving order. Shorter lists are returned unchanged.
     */
    public static <T> List<T> truncate(List<T> list, int max) {
        return list.size() <= max ? list : list.subList(0, max);
    }

    private static String stripFences(String candidate) {
        // Remove a ```json (or bare ```) opening line and a closing ``` if the whole reply is fenced
        String stripped = candidate;
        if (stripped.startsWith("```")) {
            int newline = stripped.indexOf('\n');
            stripped = newline < 0 ? stripped.substring(3) : stripped.substring(newline + 1);
            if (stripped.startsWith("json")) {
                stripped = stripped.substring(4);
            }
        }
        if (stripped.endsWith("```")) {
            stripped = stripped.substring(0, stripped.length() - 3);
        }
        return stripped.trim();
    }
}
