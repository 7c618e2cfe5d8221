package io.github.hide212131.langchain4j.incident.runtime.adapter.llm;

import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterException;
import io.github.hide212131.langchain4j.incident.runtime.adapter.DiagnosticEngine;
import io.github.hide212131.langchain4j.incident.runtime.adapter.DiagnosticRequest;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import io.github.hide212131.langchain4j.incident.runtime.provider.LlmReasoningClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class LlmDiagnosticEngine extends LlmJsonAdapter implements DiagnosticEngine {

    public LlmDiagnosticEngine(LlmReasoningClient client, ObjectMapper objectMapper) {
        super(client, objectMapper);
    }

    @Override
    String instruction() {
        return """
                You are an SRE diagnosing a production incident from symptoms, context and the alert.
                Fields: rootCause (string), confidenceScore (number between 0 and 1), affectedComponents (array of
                strings), evidence (array of strings), impactAssessment (string).
                Use a low confidenceScore when the evidence is thin.""";
    }

    @Override
    public Diagnosis diagnose(DiagnosticRequest request) throws AdapterException {
        JsonNode reply = ask("Incident data:\n" + json(request));
        String rootCause = text(reply, "rootCause", null);
        if (rootCause == null) {
            throw new AdapterException("model reply has no rootCause");
        }
        return new Diagnosis(
                null,
                rootCause,
                number(reply, "confidenceScore", 0.0),
                strings(reply, "affectedComponents"),
                strings(reply, "evidence"),
                text(reply, "impactAssessment", ""));
    }
}
