package io.github.hide212131.langchain4j.incident.runtime.state;

/**
 * Result fields that belong to exactly one business step.
 */
public enum ResultField {
    ANALYSIS(StepName.PROCESS_ALERT),
    DIAGNOSIS(StepName.DIAGNOSE_ISSUE),
    PLAN(StepName.PLAN_ACTIONS),
    EXECUTION(StepName.EXECUTE_ACTIONS),
    REPORT(StepName.GENERATE_REPORT);

    private final StepName owner;

    ResultField(StepName owner) {
        this.owner = owner;
    }

    public StepName owner() {
        return owner;
    }

    public boolean writableBy(StepName step) {
        return step == owner || step == StepName.INITIALIZE;
    }
}
