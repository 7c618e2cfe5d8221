package io.github.hide212131.langchain4j.incident.runtime.adapter.llm;

import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterException;
import io.github.hide212131.langchain4j.incident.runtime.adapter.ReportGenerator;
import io.github.hide212131.langchain4j.incident.runtime.model.ReportDraft;
import io.github.hide212131.langchain4j.incident.runtime.provider.LlmReasoningClient;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;

public final class LlmReportGenerator extends LlmJsonAdapter implements ReportGenerator {

    public LlmReportGenerator(LlmReasoningClient client, ObjectMapper objectMapper) {
        super(client, objectMapper);
    }

    @Override
    String instruction() {
        return """
                You write incident post-mortem reports for operators.
                Fields: summary (string), sections (object mapping section title to text), keyFindings (array of
                strings), recommendations (array of strings).""";
    }

    @Override
    public ReportDraft generate(IncidentState state) throws AdapterException {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("alert", state.alertInfo());
        input.put("symptoms", state.symptoms());
        input.put("analysis", state.analysisResult());
        input.put("diagnosis", state.diagnosticResult());
        input.put("plan", state.actionPlan());
        input.put("execution", state.executionResult());
        input.put("errors", state.errors());
        JsonNode reply = ask("Incident record:\n" + json(input));
        String summary = text(reply, "summary", null);
        if (summary == null) {
            throw new AdapterException("model reply has no summary");
        }
        return new ReportDraft(summary, stringMap(reply, "sections"), strings(reply, "keyFindings"),
                strings(reply, "recommendations"));
    }
}
