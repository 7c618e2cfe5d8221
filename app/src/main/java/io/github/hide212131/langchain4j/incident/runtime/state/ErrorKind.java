package io.github.hide212131.langchain4j.incident.runtime.state;

public enum ErrorKind {
    PRECONDITION_MISSING,
    ADAPTER_FAILURE,
    SUSPENSION_EXHAUSTED,
    CYCLE_LIMIT_EXCEEDED,
    INVALID_INPUT,
    STEP_FAILURE,
    SESSION_TIMEOUT
}
