package com.example.LlmCouncil.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient parsing of JSON objects embedded in model replies.
 * <p>
 * Handles the usual deviations of chat models:
 * <ul>
 *   <li>Markdown code fences around the object</li>
 *   <li>Prose before or after the object</li>
 *   <li>Trailing commas, comments, single quotes, unquoted field names</li>
 *   <li>Numbers sent as strings ("55", "55%")</li>
 * </ul>
 */
public final class JsonReplyParser {

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** A reply that is one fenced block as a whole; fences inside string values do not match. */
    private static final Pattern FENCED = Pattern.compile("^```(?:json|JSON)?\\s*(.*)```\\s*$", Pattern.DOTALL);

    private JsonReplyParser() {
    }

    /**
     * Parse the JSON object in the reply. The whole reply is tried first, then the body of a
     * reply-wide code fence, then the span from the first '{' to the last '}'.
     */
    public static Optional<JsonNode> parseObject(String reply) {
        if (reply == null || reply.isBlank()) {
            return Optional.empty();
        }
        String candidate = reply.trim();

        Optional<JsonNode> whole = readObject(candidate);
        if (whole.isPresent()) {
            return whole;
        }

        Matcher fenced = FENCED.matcher(candidate);
        if (fenced.matches()) {
            candidate = fenced.group(1).trim();
        }

        int start = candidate.indexOf('{');
        int end = candidate.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return readObject(candidate.substring(start, end + 1));
    }

    private static Optional<JsonNode> readObject(String text) {
        try {
            JsonNode node = LENIENT_MAPPER.readTree(text);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * Numeric field value, accepting JSON numbers and numeric strings.
     */
    public static OptionalDouble number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return OptionalDouble.empty();
        }
        if (value.isNumber()) {
            return OptionalDouble.of(value.asDouble());
        }
        if (value.isTextual()) {
            return NumberExtractor.firstNumber(value.asText());
        }
        return OptionalDouble.empty();
    }

    public static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        String text = value.isTextual() ? value.asText() : value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }
}
