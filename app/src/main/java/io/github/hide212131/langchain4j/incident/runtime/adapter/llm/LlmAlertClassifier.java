package io.github.hide212131.langchain4j.incident.runtime.adapter.llm;

import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterException;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AlertClassifier;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertAnalysis;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.provider.LlmReasoningClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class LlmAlertClassifier extends LlmJsonAdapter implements AlertClassifier {

    public LlmAlertClassifier(LlmReasoningClient client, ObjectMapper objectMapper) {
        super(client, objectMapper);
    }

    @Override
    String instruction() {
        return """
                You are an SRE alert triage assistant. Classify the alert.
                Fields: category (network, cpu, memory, disk or application), priority (critical, high, medium or low),
                severityScore (number between 0 and 1), correlationHints (array of strings).""";
    }

    @Override
    public AlertAnalysis classify(AlertInfo alert) throws AdapterException {
        JsonNode reply = ask("Alert:\n" + json(alert));
        return new AlertAnalysis(
                alert.id(),
                text(reply, "category", "application"),
                text(reply, "priority", "medium"),
                number(reply, "severityScore", 0.5),
                strings(reply, "correlationHints"));
    }
}
