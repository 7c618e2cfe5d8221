package io.github.hide212131.langchain4j.incident.runtime.state;

import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertAnalysis;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import io.github.hide212131.langchain4j.incident.runtime.model.ExecutionOutcome;
import io.github.hide212131.langchain4j.incident.runtime.model.IncidentReport;
import java.util.Map;
import java.util.Objects;

/**
 * Applies a {@link StateUpdate} to a state record.
 *
 * <ul>
 *   <li>Result fields are overwritten whole, and only by the step that owns them.</li>
 *   <li>{@code conversation} and {@code errors} are appended; {@code symptoms} are unioned.</li>
 *   <li>{@code context} entries are overridden key by key.</li>
 *   <li>A terminal state accepts no further updates.</li>
 * </ul>
 */
public final class StateMerger {

    private StateMerger() {
    }

    public static IncidentState merge(IncidentState state, StateUpdate update) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(update, "update");
        if (state.isTerminal()) {
            throw new IllegalStateException("Session " + state.sessionId() + " is terminal (" + state.status()
                    + "); update from " + update.owner() + " rejected");
        }

        IncidentState.Builder builder = state.toBuilder();
        for (Map.Entry<ResultField, Object> entry : update.results().entrySet()) {
            applyResult(builder, update.owner(), entry.getKey(), entry.getValue());
        }
        if (update.alertInfo() != null) {
            builder.alertInfo(update.alertInfo());
        }
        builder.addSymptoms(update.symptoms());
        builder.putContext(update.context());
        update.messages().forEach(builder::addMessage);
        update.errors().forEach(builder::addError);
        builder.resolveRequests(update.resolvedRequests());
        update.requests().forEach(builder::addRequest);
        if (update.approval() != null) {
            builder.approval(update.approval());
        }
        if (update.isFailed()) {
            builder.recordFailure(update.owner());
        }
        return builder.build();
    }

    private static void applyResult(IncidentState.Builder builder, StepName owner, ResultField field, Object value) {
        if (!field.writableBy(owner)) {
            throw new IllegalStateException(owner + " may not write " + field + " (owned by " + field.owner() + ")");
        }
        switch (field) {
            case ANALYSIS -> builder.analysisResult((AlertAnalysis) value);
            case DIAGNOSIS -> builder.diagnosticResult((Diagnosis) value);
            case PLAN -> builder.actionPlan((ActionPlan) value);
            case EXECUTION -> builder.executionResult((ExecutionOutcome) value);
            case REPORT -> builder.report((IncidentReport) value);
            default -> throw new IllegalStateException("Unhandled result field: " + field);
        }
    }
}
