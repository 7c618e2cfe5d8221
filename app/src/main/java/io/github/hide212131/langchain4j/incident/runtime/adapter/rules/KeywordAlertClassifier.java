package io.github.hide212131.langchain4j.incident.runtime.adapter.rules;

import io.github.hide212131.langchain4j.incident.runtime.adapter.AlertClassifier;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertAnalysis;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifies an alert by the keywords in its id, message and tags.
 */
public final class KeywordAlertClassifier implements AlertClassifier {

    @Override
    public AlertAnalysis classify(AlertInfo alert) {
        List<String> texts = new ArrayList<>();
        texts.add(alert.id());
        texts.add(alert.message());
        texts.addAll(alert.tags());
        IncidentCategory category = IncidentCategory.best(texts);
        String label = category == null ? IncidentCategory.APPLICATION.label() : category.label();

        List<String> hints = new ArrayList<>();
        if (!"unknown".equals(alert.source())) {
            hints.add("correlate with other alerts from " + alert.source());
        }
        if (!alert.metrics().isEmpty()) {
            hints.add("metrics reported: " + String.join(", ", alert.metrics().keySet()));
        }
        return new AlertAnalysis(alert.id(), label, priority(alert.severity()), severityScore(alert.severity()), hints);
    }

    static String priority(String severity) {
        return switch (severity) {
            case "critical", "high", "medium", "low" -> severity;
            case "warning" -> "low";
            default -> "medium";
        };
    }

    static double severityScore(String severity) {
        return switch (severity) {
            case "critical" -> 1.0;
            case "high" -> 0.8;
            case "medium" -> 0.5;
            case "low", "warning" -> 0.2;
            default -> 0.4;
        };
    }
}
