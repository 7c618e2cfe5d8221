package io.github.hide212131.langchain4j.incident.runtime.adapter.rules;

import io.github.hide212131.langchain4j.incident.runtime.adapter.ExecutionBackend;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionStep;
import io.github.hide212131.langchain4j.incident.runtime.model.ExecutionOutcome;
import io.github.hide212131.langchain4j.incident.runtime.model.StepExecution;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Pretends to run every step successfully. Used for dry runs.
 */
public final class SimulatedExecutionBackend implements ExecutionBackend {

    private final Clock clock;

    public SimulatedExecutionBackend() {
        this(Clock.systemUTC());
    }

    public SimulatedExecutionBackend(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public ExecutionOutcome execute(ActionPlan plan) {
        List<StepExecution> outcomes = plan.steps().stream()
                .map(SimulatedExecutionBackend::simulate)
                .toList();
        return new ExecutionOutcome(plan.planId(), ExecutionOutcome.summarise(outcomes), outcomes, "simulated",
                clock.instant());
    }

    private static StepExecution simulate(ActionStep step) {
        return new StepExecution(step.stepId(), true, "simulated: " + step.command());
    }
}
