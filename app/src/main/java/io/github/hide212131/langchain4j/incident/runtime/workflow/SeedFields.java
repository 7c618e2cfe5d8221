package io.github.hide212131.langchain4j.incident.runtime.workflow;

import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertAnalysis;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured part of a session seed. Every field is optional.
 */
public record SeedFields(
        AlertInfo alertInfo,
        List<String> symptoms,
        Map<String, Object> context,
        AlertAnalysis analysisResult,
        Diagnosis diagnosticResult,
        ActionPlan actionPlan) {

    public SeedFields {
        symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static SeedFields empty() {
        return new SeedFields(null, null, null, null, null, null);
    }
}
