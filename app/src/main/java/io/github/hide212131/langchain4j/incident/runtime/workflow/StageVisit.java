package io.github.hide212131.langchain4j.incident.runtime.workflow;

import java.util.Objects;

/**
 * One routed step of a session, numbered by router cycle.
 */
public record StageVisit(int attempt, String stage) {
    public StageVisit {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be 1-indexed");
        }
        Objects.requireNonNull(stage, "stage");
    }
}
