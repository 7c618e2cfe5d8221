package io.github.hide212131.langchain4j.incident.runtime.state;

public enum RequestKind {
    /** A step could not start because an input field is absent. */
    MISSING_INPUT,
    /** A result came back below its confidence threshold. */
    CLARIFICATION,
    /** A remediation plan waits for an operator decision. */
    APPROVAL
}
