package io.github.hide212131.langchain4j.incident.runtime.adapter;

import io.github.hide212131.langchain4j.incident.runtime.model.AlertAnalysis;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input of a diagnostic engine. {@code alertInfo} and {@code analysis} may be null when the
 * session started from free text.
 */
public record DiagnosticRequest(
        List<String> symptoms,
        Map<String, Object> context,
        AlertInfo alertInfo,
        AlertAnalysis analysis,
        List<String> operatorNotes) {

    public DiagnosticRequest {
        symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        operatorNotes = operatorNotes == null ? List.of() : List.copyOf(operatorNotes);
    }
}
