package io.github.hide212131.langchain4j.incident.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a report generator returns; the report step turns it into an {@link IncidentReport}.
 */
public record ReportDraft(
        String summary,
        Map<String, String> sections,
        List<String> keyFindings,
        List<String> recommendations) {

    public ReportDraft {
        if (summary == null || summary.isBlank()) {
            throw new IllegalArgumentException("summary must be provided");
        }
        sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
        keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
