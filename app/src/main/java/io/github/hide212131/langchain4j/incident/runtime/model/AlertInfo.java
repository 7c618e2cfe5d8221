package io.github.hide212131.langchain4j.incident.runtime.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured alert as received from a monitoring system or extracted from operator text.
 */
public record AlertInfo(
        String id,
        Instant timestamp,
        String severity,
        String source,
        String message,
        Map<String, Object> metrics,
        List<String> tags) {

    public AlertInfo {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("alert id must be provided");
        }
        severity = severity == null || severity.isBlank() ? "unknown" : severity.trim().toLowerCase();
        source = source == null || source.isBlank() ? "unknown" : source.trim();
        message = message == null ? "" : message.trim();
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static AlertInfo of(String id, String severity) {
        return new AlertInfo(id, null, severity, null, null, null, null);
    }
}
