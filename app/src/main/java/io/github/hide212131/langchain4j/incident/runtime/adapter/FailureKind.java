package io.github.hide212131.langchain4j.incident.runtime.adapter;

public enum FailureKind {
    TIMEOUT,
    REJECTED,
    FAILED,
    INTERRUPTED
}
