package io.github.hide212131.langchain4j.incident.runtime.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Recorded result of the execute step. Operator rejections are recorded here too, so a rejected
 * plan still leaves a trace of what did (not) happen.
 */
public record ExecutionOutcome(
        String planId,
        ExecutionStatus status,
        List<StepExecution> perStepOutcome,
        String reason,
        Instant finishedAt) {

    public ExecutionOutcome {
        Objects.requireNonNull(planId, "planId");
        Objects.requireNonNull(status, "status");
        perStepOutcome = perStepOutcome == null ? List.of() : List.copyOf(perStepOutcome);
        reason = reason == null ? "" : reason;
    }

    public static ExecutionStatus summarise(List<StepExecution> outcomes) {
        long succeeded = outcomes.stream().filter(StepExecution::succeeded).count();
        if (succeeded == outcomes.size()) {
            return ExecutionStatus.SUCCESS;
        }
        return succeeded == 0 ? ExecutionStatus.FAILED : ExecutionStatus.PARTIAL;
    }
}
