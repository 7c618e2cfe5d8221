package io.github.hide212131.langchain4j.incident.runtime.step;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.runtime.adapter.ActionPlanner;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterInvoker;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class PlanActionsStep extends AdapterBackedStep {

    private final ActionPlanner planner;

    public PlanActionsStep(ActionPlanner planner, AdapterInvoker invoker, WorkflowLogger logger, Clock clock) {
        super(invoker, logger, clock);
        this.planner = Objects.requireNonNull(planner, "planner");
    }

    @Override
    public StepName name() {
        return StepName.PLAN_ACTIONS;
    }

    @Override
    Optional<String> missingInput(IncidentState state) {
        return state.diagnosticResult() == null ? Optional.of("diagnosticResult") : Optional.empty();
    }

    @Override
    StepOutcome execute(IncidentState state) {
        Diagnosis diagnosis = state.diagnosticResult();
        Map<String, Object> context = state.context();
        ActionPlan plan = call("action_planner", () -> planner.plan(diagnosis, context));
        return StepOutcome.proceed(StateUpdate.by(name())
                .plan(plan)
                .message(narrate("Prepared plan " + plan.planId() + " with " + plan.steps().size()
                        + " step(s), risk " + plan.riskLevel() + ", ETA " + plan.etaMinutes() + " min.")));
    }
}
