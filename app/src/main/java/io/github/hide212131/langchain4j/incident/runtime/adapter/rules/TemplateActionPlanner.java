package io.github.hide212131.langchain4j.incident.runtime.adapter.rules;

import io.github.hide212131.langchain4j.incident.runtime.adapter.ActionPlanner;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionStep;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fixed remediation templates per incident category.
 */
public final class TemplateActionPlanner implements ActionPlanner {

    @Override
    public ActionPlan plan(Diagnosis diagnosis, Map<String, Object> context) {
        List<String> texts = new ArrayList<>();
        texts.add(diagnosis.rootCause());
        texts.addAll(diagnosis.evidence());
        IncidentCategory category = IncidentCategory.best(texts);
        String target = diagnosis.affectedComponents().isEmpty() ? "affected service"
                : String.join(",", diagnosis.affectedComponents());
        String planId = "plan-" + diagnosis.diagnosisId();

        if (category == null) {
            return new ActionPlan(planId, List.of(
                    new ActionStep("1", "diagnostic", "Collect diagnostics from " + target, "collect-diagnostics " + target,
                            "low", null),
                    new ActionStep("2", "escalation", "Escalate to the on-call engineer", "page on-call", "low", null)),
                    "low", List.of(), 15, false);
        }
        return switch (category) {
            case CPU -> new ActionPlan(planId, List.of(
                    new ActionStep("1", "diagnostic", "Inspect the busiest processes on " + target,
                            "ps aux --sort=-%cpu | head", "low", null),
                    new ActionStep("2", "scale", "Scale out the " + target + " pool by one instance",
                            "scale-out " + target + " +1", "medium", "scale-in " + target + " -1")),
                    "medium",
                    List.of(new ActionStep("r1", "scale", "Scale the pool back in", "scale-in " + target + " -1", "low", null)),
                    10, false);
            case MEMORY -> new ActionPlan(planId, List.of(
                    new ActionStep("1", "diagnostic", "Capture a heap histogram on " + target, "jmap -histo " + target,
                            "low", null),
                    new ActionStep("2", "restart", "Restart the service on " + target, "systemctl restart app@" + target,
                            "high", null)),
                    "high", List.of(), 20, false);
            case DISK -> new ActionPlan(planId, List.of(
                    new ActionStep("1", "cleanup", "Compress rotated logs on " + target, "logrotate --force", "low", null),
                    new ActionStep("2", "resize", "Expand the data volume of " + target, "expand-volume " + target + " +20G",
                            "medium", null)),
                    "medium", List.of(), 25, false);
            case NETWORK -> new ActionPlan(planId, List.of(
                    new ActionStep("1", "diagnostic", "Trace the route to " + target, "mtr -rw " + target, "low", null),
                    new ActionStep("2", "failover", "Fail traffic over to the secondary link", "failover secondary-link",
                            "medium", "failover primary-link")),
                    "medium",
                    List.of(new ActionStep("r1", "failover", "Return traffic to the primary link", "failover primary-link",
                            "low", null)),
                    15, false);
            case APPLICATION -> new ActionPlan(planId, List.of(
                    new ActionStep("1", "diagnostic", "Collect recent error logs from " + target,
                            "tail-errors " + target + " --since 30m", "low", null),
                    new ActionStep("2", "rollback", "Roll back the latest deployment of " + target,
                            "deploy rollback " + target, "medium", "deploy redo " + target)),
                    "medium", List.of(), 20, false);
        };
    }
}
