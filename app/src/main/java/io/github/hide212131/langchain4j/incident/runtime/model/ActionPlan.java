package io.github.hide212131.langchain4j.incident.runtime.model;

import java.util.List;
import java.util.Locale;

/**
 * Remediation plan: ordered steps, overall risk, rollback steps and an ETA in minutes.
 */
public record ActionPlan(
        String planId,
        List<ActionStep> steps,
        String riskLevel,
        List<ActionStep> rollbackPlan,
        int etaMinutes,
        boolean approvalRequired) {

    public ActionPlan {
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("planId must be provided");
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
        riskLevel = riskLevel == null || riskLevel.isBlank() ? "medium" : riskLevel.trim().toLowerCase(Locale.ROOT);
        rollbackPlan = rollbackPlan == null ? List.of() : List.copyOf(rollbackPlan);
        if (etaMinutes < 0) {
            throw new IllegalArgumentException("etaMinutes must not be negative");
        }
    }
}
