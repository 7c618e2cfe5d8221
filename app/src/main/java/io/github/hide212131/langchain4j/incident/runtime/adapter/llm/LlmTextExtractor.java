package io.github.hide212131.langchain4j.incident.runtime.adapter.llm;

import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterException;
import io.github.hide212131.langchain4j.incident.runtime.adapter.TextExtractor;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.model.ExtractionResult;
import io.github.hide212131.langchain4j.incident.runtime.provider.LlmReasoningClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

public final class LlmTextExtractor extends LlmJsonAdapter implements TextExtractor {

    public LlmTextExtractor(LlmReasoningClient client, ObjectMapper objectMapper) {
        super(client, objectMapper);
    }

    @Override
    String instruction() {
        return """
                You extract incident facts from an operator message.
                Fields: isAlert (boolean), severity (critical, high, medium, low or unknown), source (host or service
                name, may be empty), tags (array of strings), symptoms (array of strings), context (object of string
                values), confidence (number between 0 and 1).
                Leave arrays empty when the message contains no incident information.""";
    }

    @Override
    public ExtractionResult extract(String text) throws AdapterException {
        if (text == null || text.isBlank()) {
            return ExtractionResult.nothing();
        }
        JsonNode reply = ask("Operator message:\n" + text);
        AlertInfo alert = null;
        JsonNode isAlert = reply.get("isAlert");
        if (isAlert != null && isAlert.asBoolean(false)) {
            alert = new AlertInfo(
                    "nl-" + UUID.randomUUID().toString().substring(0, 8),
                    Instant.now(),
                    text(reply, "severity", null),
                    text(reply, "source", null),
                    text.trim(),
                    Map.of(),
                    strings(reply, "tags"));
        }
        Map<String, Object> context = new LinkedHashMap<>(stringMap(reply, "context"));
        return new ExtractionResult(alert, strings(reply, "symptoms"), context, number(reply, "confidence", 0.5));
    }
}
