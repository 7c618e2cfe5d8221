package io.github.hide212131.langchain4j.incident.runtime.state;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry in the append-only error history of a session.
 */
public record WorkflowError(ErrorKind kind, String source, String message, Instant timestamp) {

    public WorkflowError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(source, "source");
        message = message == null ? "" : message;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static WorkflowError of(ErrorKind kind, StepName source, String message) {
        return new WorkflowError(kind, source.wireName(), message, Instant.now());
    }

    public static WorkflowError engine(ErrorKind kind, String message) {
        return new WorkflowError(kind, "engine", message, Instant.now());
    }
}
