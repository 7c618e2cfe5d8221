package io.github.hide212131.langchain4j.incident.runtime.model;

import java.util.Objects;

/** Outcome of one executed plan step. */
public record StepExecution(String stepId, boolean succeeded, String detail) {

    public StepExecution {
        Objects.requireNonNull(stepId, "stepId");
        detail = detail == null ? "" : detail;
    }
}
