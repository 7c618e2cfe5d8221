package io.github.hide212131.langchain4j.incident.runtime.model;

public enum ReportStatus {
    GENERATED,
    FALLBACK
}
