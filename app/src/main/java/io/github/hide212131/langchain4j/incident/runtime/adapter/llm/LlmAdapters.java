package io.github.hide212131.langchain4j.incident.runtime.adapter.llm;

import io.github.hide212131.langchain4j.incident.runtime.adapter.ExecutionBackend;
import io.github.hide212131.langchain4j.incident.runtime.adapter.ReasoningAdapters;
import io.github.hide212131.langchain4j.incident.runtime.provider.LlmReasoningClient;
import io.github.hide212131.langchain4j.incident.runtime.state.StateJson;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds the model-backed adapter set. Execution is never delegated to the model; the caller
 * supplies the backend that performs the actions.
 */
public final class LlmAdapters {

    private LlmAdapters() {
    }

    public static ReasoningAdapters create(LlmReasoningClient client, ExecutionBackend executionBackend) {
        ObjectMapper objectMapper = StateJson.objectMapper();
        return new ReasoningAdapters(
                new LlmAlertClassifier(client, objectMapper),
                new LlmDiagnosticEngine(client, objectMapper),
                new LlmActionPlanner(client, objectMapper),
                executionBackend,
                new LlmReportGenerator(client, objectMapper),
                new LlmTextExtractor(client, objectMapper));
    }
}
