package io.github.hide212131.langchain4j.incident.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial structured fields recovered from free text. Any of the fields may be absent.
 */
public record ExtractionResult(
        AlertInfo alertInfo,
        List<String> symptoms,
        Map<String, Object> context,
        double confidence) {

    public ExtractionResult {
        symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
    }

    public static ExtractionResult nothing() {
        return new ExtractionResult(null, List.of(), Map.of(), 0.0);
    }

    public boolean hasFindings() {
        return alertInfo != null || !symptoms.isEmpty() || !context.isEmpty();
    }
}
