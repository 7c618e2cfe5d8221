package io.github.hide212131.langchain4j.incident.runtime.state;

import java.util.Locale;

/**
 * Named stages of the incident workflow. {@link #TERMINAL} is the router's stop marker and never
 * runs as a step.
 */
public enum StepName {
    INITIALIZE("initialize"),
    PROCESS_ALERT("process_alert"),
    DIAGNOSE_ISSUE("diagnose_issue"),
    PLAN_ACTIONS("plan_actions"),
    EXECUTE_ACTIONS("execute_actions"),
    GENERATE_REPORT("generate_report"),
    COLLECT_INFO("collect_info"),
    TERMINAL("terminal");

    private final String wireName;

    StepName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static StepName fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("step name must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (StepName candidate : values()) {
            if (candidate.wireName.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown step: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
