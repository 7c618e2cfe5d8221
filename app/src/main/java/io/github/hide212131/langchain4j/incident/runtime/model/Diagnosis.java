package io.github.hide212131.langchain4j.incident.runtime.model;

import java.util.List;
import java.util.UUID;

/**
 * Root-cause hypothesis produced by the diagnostic engine. Every diagnosis carries its own id so
 * that a clarification request can be tied to the exact diagnosis that triggered it.
 */
public record Diagnosis(
        String diagnosisId,
        String rootCause,
        double confidenceScore,
        List<String> affectedComponents,
        List<String> evidence,
        String impactAssessment) {

    public Diagnosis {
        diagnosisId = diagnosisId == null || diagnosisId.isBlank() ? UUID.randomUUID().toString() : diagnosisId;
        if (rootCause == null || rootCause.isBlank()) {
            throw new IllegalArgumentException("rootCause must be provided");
        }
        if (Double.isNaN(confidenceScore) || confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidenceScore must be within [0,1]: " + confidenceScore);
        }
        affectedComponents = affectedComponents == null ? List.of() : List.copyOf(affectedComponents);
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        impactAssessment = impactAssessment == null ? "" : impactAssessment;
    }

    public Diagnosis withDiagnosisId(String value) {
        return new Diagnosis(value, rootCause, confidenceScore, affectedComponents, evidence, impactAssessment);
    }

    public boolean isConfident(double threshold) {
        return confidenceScore >= threshold;
    }
}
