package io.github.hide212131.langchain4j.incident.runtime.workflow;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterInvoker;
import io.github.hide212131.langchain4j.incident.runtime.adapter.ReasoningAdapters;
import io.github.hide212131.langchain4j.incident.runtime.config.EngineSettings;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import io.github.hide212131.langchain4j.incident.runtime.step.ApprovalPolicy;
import io.github.hide212131.langchain4j.incident.runtime.step.CollectInfoStep;
import io.github.hide212131.langchain4j.incident.runtime.step.DiagnoseIssueStep;
import io.github.hide212131.langchain4j.incident.runtime.step.ExecuteActionsStep;
import io.github.hide212131.langchain4j.incident.runtime.step.GenerateReportStep;
import io.github.hide212131.langchain4j.incident.runtime.step.PlanActionsStep;
import io.github.hide212131.langchain4j.incident.runtime.step.ProcessAlertStep;
import io.github.hide212131.langchain4j.incident.runtime.step.WorkflowStep;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the business steps to their adapters.
 */
final class WorkflowSteps {

    private WorkflowSteps() {
    }

    static Map<StepName, WorkflowStep> standard(
            ReasoningAdapters adapters,
            EngineSettings settings,
            AdapterInvoker invoker,
            WorkflowLogger logger,
            Clock clock) {
        Map<StepName, WorkflowStep> steps = new EnumMap<>(StepName.class);
        register(steps, new ProcessAlertStep(adapters.alertClassifier(), invoker, logger, clock));
        register(steps, new DiagnoseIssueStep(adapters.diagnosticEngine(), invoker, logger, clock));
        register(steps, new PlanActionsStep(adapters.actionPlanner(), invoker, logger, clock));
        register(steps, new ExecuteActionsStep(adapters.executionBackend(),
                new ApprovalPolicy(settings.autoExecution()), invoker, logger, clock));
        register(steps, new GenerateReportStep(adapters.reportGenerator(), settings.maxStepAttempts(), invoker, logger,
                clock));
        register(steps, new CollectInfoStep(logger));
        return steps;
    }

    private static void register(Map<StepName, WorkflowStep> steps, WorkflowStep step) {
        steps.put(step.name(), step);
    }
}
