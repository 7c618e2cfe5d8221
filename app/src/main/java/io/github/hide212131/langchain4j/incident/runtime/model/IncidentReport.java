package io.github.hide212131.langchain4j.incident.runtime.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record IncidentReport(
        String incidentId,
        String title,
        String summary,
        Map<String, String> sections,
        List<String> keyFindings,
        List<String> recommendations,
        ReportStatus status,
        Instant generatedAt) {

    public IncidentReport {
        Objects.requireNonNull(incidentId, "incidentId");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(status, "status");
        sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
        keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
