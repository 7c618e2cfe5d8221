package io.github.hide212131.langchain4j.incident.runtime.step;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterInvoker;
import io.github.hide212131.langchain4j.incident.runtime.adapter.ExecutionBackend;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionStep;
import io.github.hide212131.langchain4j.incident.runtime.model.ExecutionOutcome;
import io.github.hide212131.langchain4j.incident.runtime.model.ExecutionStatus;
import io.github.hide212131.langchain4j.incident.runtime.state.ApprovalDecision;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.InformationRequest;
import io.github.hide212131.langchain4j.incident.runtime.state.RequestKind;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs the plan through the execution backend once it may run: either the approval policy lets
 * it through, or the operator approved this exact plan. Rejections and modification requests are
 * recorded as execution results without touching the backend.
 */
public final class ExecuteActionsStep extends AdapterBackedStep {

    private final ExecutionBackend backend;
    private final ApprovalPolicy approvalPolicy;

    public ExecuteActionsStep(
            ExecutionBackend backend,
            ApprovalPolicy approvalPolicy,
            AdapterInvoker invoker,
            WorkflowLogger logger,
            Clock clock) {
        super(invoker, logger, clock);
        this.backend = Objects.requireNonNull(backend, "backend");
        this.approvalPolicy = Objects.requireNonNull(approvalPolicy, "approvalPolicy");
    }

    @Override
    public StepName name() {
        return StepName.EXECUTE_ACTIONS;
    }

    @Override
    Optional<String> missingInput(IncidentState state) {
        return state.actionPlan() == null ? Optional.of("actionPlan") : Optional.empty();
    }

    @Override
    StepOutcome execute(IncidentState state) {
        ActionPlan plan = state.actionPlan();
        Optional<String> approvalReason = approvalPolicy.approvalReason(plan);
        if (approvalReason.isPresent()) {
            Optional<ApprovalDecision> decision = state.approvalFor(plan.planId());
            if (decision.isEmpty()) {
                logger.info("[{}] plan {} waits for approval: {}", state.sessionId(), plan.planId(),
                        approvalReason.get());
                return StepOutcome.proceed(StateUpdate.by(name())
                        .request(approvalRequest(plan, approvalReason.get(), state.collectionAttempts()))
                        .message(narrate("Plan " + plan.planId() + " needs approval: " + approvalReason.get() + ".")));
            }
            switch (decision.get()) {
                case REJECTED:
                    return notExecuted(plan, ExecutionStatus.REJECTED_BY_OPERATOR, "rejected by operator");
                case MODIFICATION_REQUESTED:
                    return notExecuted(plan, ExecutionStatus.MODIFICATION_REQUESTED, "operator requested changes");
                case APPROVED:
                default:
                    break;
            }
        }

        ExecutionOutcome outcome = call("execution_backend", () -> backend.execute(plan));
        return StepOutcome.proceed(StateUpdate.by(name())
                .execution(outcome)
                .message(narrate("Executed plan " + plan.planId() + ": " + outcome.status() + ".")));
    }

    private StepOutcome notExecuted(ActionPlan plan, ExecutionStatus status, String reason) {
        ExecutionOutcome outcome = new ExecutionOutcome(plan.planId(), status, List.of(), reason, clock.instant());
        return StepOutcome.proceed(StateUpdate.by(name())
                .execution(outcome)
                .message(narrate("Plan " + plan.planId() + " was not executed: " + reason + ".")));
    }

    private InformationRequest approvalRequest(ActionPlan plan, String reason, int attempt) {
        String steps = plan.steps().stream()
                .map(ActionStep::description)
                .collect(Collectors.joining("; "));
        return new InformationRequest(
                "approve:" + plan.planId() + "#" + attempt,
                RequestKind.APPROVAL,
                name(),
                "Approve plan " + plan.planId() + " (" + reason + ")? Steps: " + steps
                        + ". Answer approve, reject or modify.",
                List.of("approval"),
                plan.planId());
    }
}
