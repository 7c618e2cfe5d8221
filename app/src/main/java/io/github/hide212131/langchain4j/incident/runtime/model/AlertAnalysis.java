package io.github.hide212131.langchain4j.incident.runtime.model;

import java.util.List;
import java.util.Objects;

/**
 * Output of the alert classifier: category, normalised severity score and correlation hints.
 */
public record AlertAnalysis(
        String alertId,
        String category,
        String priority,
        double severityScore,
        List<String> correlationHints) {

    public AlertAnalysis {
        Objects.requireNonNull(alertId, "alertId");
        category = category == null || category.isBlank() ? "unknown" : category.trim().toLowerCase();
        priority = priority == null || priority.isBlank() ? "medium" : priority.trim().toLowerCase();
        if (Double.isNaN(severityScore) || severityScore < 0.0 || severityScore > 1.0) {
            throw new IllegalArgumentException("severityScore must be within [0,1]: " + severityScore);
        }
        correlationHints = correlationHints == null ? List.of() : List.copyOf(correlationHints);
    }
}
