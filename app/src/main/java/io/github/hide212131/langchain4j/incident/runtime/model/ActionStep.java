package io.github.hide212131.langchain4j.incident.runtime.model;

import java.util.Locale;

public record ActionStep(
        String stepId,
        String actionType,
        String description,
        String command,
        String riskLevel,
        String rollbackCommand) {

    public ActionStep {
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("stepId must be provided");
        }
        actionType = actionType == null ? "" : actionType.trim();
        description = description == null ? "" : description.trim();
        command = command == null ? "" : command.trim();
        riskLevel = riskLevel == null || riskLevel.isBlank() ? "low" : riskLevel.trim().toLowerCase(Locale.ROOT);
    }

    /** Lower-cased concatenation of the fields an approval policy scans for risky verbs. */
    public String searchableText() {
        return (actionType + " " + description + " " + command).toLowerCase(Locale.ROOT);
    }
}
