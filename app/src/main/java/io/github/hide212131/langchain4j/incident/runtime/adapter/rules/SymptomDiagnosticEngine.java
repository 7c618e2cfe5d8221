package io.github.hide212131.langchain4j.incident.runtime.adapter.rules;

import io.github.hide212131.langchain4j.incident.runtime.adapter.DiagnosticEngine;
import io.github.hide212131.langchain4j.incident.runtime.adapter.DiagnosticRequest;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the incident category with the most supporting symptoms. Confidence grows with each
 * supporting symptom or operator note and with a prior alert analysis; with no supporting
 * evidence the diagnosis stays below the usual clarification threshold.
 */
public final class SymptomDiagnosticEngine implements DiagnosticEngine {

    static final double BASE_CONFIDENCE = 0.45;
    static final double PER_MATCH = 0.2;
    static final double ANALYSIS_BONUS = 0.1;
    static final double MAX_CONFIDENCE = 0.95;
    static final double UNDETERMINED_CONFIDENCE = 0.3;

    @Override
    public Diagnosis diagnose(DiagnosticRequest request) {
        List<String> evidenceTexts = new ArrayList<>(request.symptoms());
        evidenceTexts.addAll(request.operatorNotes());

        IncidentCategory category = IncidentCategory.best(evidenceTexts);
        if (category == null && request.analysis() != null) {
            category = IncidentCategory.fromLabel(request.analysis().category());
        }
        List<String> components = new ArrayList<>();
        if (request.alertInfo() != null && !"unknown".equals(request.alertInfo().source())) {
            components.add(request.alertInfo().source());
        }
        Object host = request.context().get("host");
        if (host != null && !components.contains(host.toString())) {
            components.add(host.toString());
        }

        if (category == null) {
            String first = evidenceTexts.isEmpty() ? "no symptoms" : evidenceTexts.get(0);
            return new Diagnosis(null, "undetermined cause (" + first + ")", UNDETERMINED_CONFIDENCE, components,
                    evidenceTexts, "impact unknown");
        }

        IncidentCategory matched = category;
        List<String> evidence = evidenceTexts.stream().filter(matched::matches).toList();
        double confidence = BASE_CONFIDENCE + PER_MATCH * evidence.size();
        if (request.analysis() != null) {
            confidence += ANALYSIS_BONUS;
        }
        confidence = Math.min(MAX_CONFIDENCE, confidence);
        return new Diagnosis(
                null,
                rootCause(category),
                confidence,
                components,
                evidence,
                "degraded " + category.label() + " capacity on " + (components.isEmpty() ? "unknown hosts" : String.join(", ", components)));
    }

    private static String rootCause(IncidentCategory category) {
        return switch (category) {
            case CPU -> "cpu saturation";
            case MEMORY -> "memory exhaustion";
            case DISK -> "disk capacity exhausted";
            case NETWORK -> "network degradation";
            case APPLICATION -> "application fault";
        };
    }
}
