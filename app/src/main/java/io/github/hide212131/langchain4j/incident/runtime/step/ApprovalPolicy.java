package io.github.hide212131.langchain4j.incident.runtime.step;

import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionStep;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides whether a plan needs an operator decision before it is executed.
 */
public final class ApprovalPolicy {

    private static final Set<String> HIGH_RISK_LEVELS = Set.of("high", "critical");
    private static final Pattern RISKY_ACTION = Pattern.compile("\\b(restart|reboot|delete|remove|kill|stop)\\b");

    private final boolean autoExecution;

    public ApprovalPolicy(boolean autoExecution) {
        this.autoExecution = autoExecution;
    }

    /** Returns the reason approval is needed, or empty when the plan may run unattended. */
    public Optional<String> approvalReason(ActionPlan plan) {
        if (!autoExecution) {
            return Optional.of("automatic execution is disabled");
        }
        if (plan.approvalRequired()) {
            return Optional.of("the plan asks for approval");
        }
        if (HIGH_RISK_LEVELS.contains(plan.riskLevel())) {
            return Optional.of("plan risk is " + plan.riskLevel());
        }
        for (ActionStep step : plan.steps()) {
            if (RISKY_ACTION.matcher(step.searchableText()).find()) {
                return Optional.of("step " + step.stepId() + " is disruptive: " + step.description());
            }
        }
        return Optional.empty();
    }
}
