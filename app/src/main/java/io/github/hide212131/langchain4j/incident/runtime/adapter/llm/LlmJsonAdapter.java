package io.github.hide212131.langchain4j.incident.runtime.adapter.llm;

import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterException;
import io.github.hide212131.langchain4j.incident.runtime.provider.LlmReasoningClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base for adapters that ask the model for a JSON object and read fields from it leniently:
 * missing fields fall back to defaults, but a reply that is not a JSON object is a failure.
 */
abstract class LlmJsonAdapter {

    private final LlmReasoningClient client;
    private final ObjectMapper objectMapper;

    LlmJsonAdapter(LlmReasoningClient client, ObjectMapper objectMapper) {
        this.client = Objects.requireNonNull(client, "client");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /** Role description sent as the system message. */
    abstract String instruction();

    final JsonNode ask(String prompt) throws AdapterException {
        String content;
        try {
            content = client.complete(instruction() + "\nAnswer with a single JSON object and nothing else.", prompt)
                    .content();
        } catch (RuntimeException e) {
            throw new AdapterException("model call failed: " + e.getMessage(), e);
        }
        return parse(content);
    }

    JsonNode parse(String content) throws AdapterException {
        String json = stripCodeFence(content);
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AdapterException("model reply is not valid JSON: " + abbreviate(content), e);
        }
        if (node == null || !node.isObject()) {
            throw new AdapterException("model reply is not a JSON object: " + abbreviate(content));
        }
        return node;
    }

    final String json(Object value) throws AdapterException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AdapterException("could not render prompt input", e);
        }
    }

    static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        String text = value.asText();
        return text.isBlank() ? fallback : text;
    }

    static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return fallback;
        }
        return Math.max(0.0, Math.min(1.0, value.asDouble()));
    }

    static List<String> strings(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        JsonNode array = node.get(field);
        if (array != null && array.isArray()) {
            array.forEach(element -> values.add(element.asText()));
        }
        return values;
    }

    static Map<String, String> stringMap(JsonNode node, String field) {
        Map<String, String> values = new LinkedHashMap<>();
        JsonNode object = node.get(field);
        if (object != null && object.isObject()) {
            object.fields().forEachRemaining(entry -> values.put(entry.getKey(), entry.getValue().asText()));
        }
        return values;
    }

    private static String stripCodeFence(String content) {
        String trimmed = content == null ? "" : content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).trim();
            }
        }
        return trimmed;
    }

    private static String abbreviate(String content) {
        if (content == null) {
            return "(empty)";
        }
        return content.length() <= 120 ? content : content.substring(0, 120) + "...";
    }
}
