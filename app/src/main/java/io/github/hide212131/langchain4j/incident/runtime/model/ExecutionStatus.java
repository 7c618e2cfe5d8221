package io.github.hide212131.langchain4j.incident.runtime.model;

public enum ExecutionStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    REJECTED_BY_OPERATOR,
    MODIFICATION_REQUESTED
}
