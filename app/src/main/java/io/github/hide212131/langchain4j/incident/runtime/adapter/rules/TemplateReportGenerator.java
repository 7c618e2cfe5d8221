package io.github.hide212131.langchain4j.incident.runtime.adapter.rules;

import io.github.hide212131.langchain4j.incident.runtime.adapter.ReportGenerator;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionStep;
import io.github.hide212131.langchain4j.incident.runtime.model.ReportDraft;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.WorkflowError;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a plain-text report from whatever the session accumulated.
 */
public final class TemplateReportGenerator implements ReportGenerator {

    @Override
    public ReportDraft generate(IncidentState state) {
        Map<String, String> sections = new LinkedHashMap<>();
        List<String> findings = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        if (state.alertInfo() != null) {
            sections.put("Alert", String.format(Locale.ROOT, "%s (%s) from %s: %s", state.alertInfo().id(),
                    state.alertInfo().severity(), state.alertInfo().source(), state.alertInfo().message()));
        }
        if (state.analysisResult() != null) {
            sections.put("Classification", state.analysisResult().category() + ", priority "
                    + state.analysisResult().priority());
        }
        if (state.hasSymptoms()) {
            sections.put("Symptoms", String.join("; ", state.symptoms()));
        }
        if (state.diagnosticResult() != null) {
            sections.put("Diagnosis", String.format(Locale.ROOT, "%s (confidence %.2f)",
                    state.diagnosticResult().rootCause(), state.diagnosticResult().confidenceScore()));
            findings.add("Root cause: " + state.diagnosticResult().rootCause());
            state.diagnosticResult().evidence().forEach(evidence -> findings.add("Evidence: " + evidence));
        }
        if (state.actionPlan() != null) {
            sections.put("Actions", state.actionPlan().steps().stream()
                    .map(ActionStep::description)
                    .collect(Collectors.joining("; ")));
            if (!state.actionPlan().rollbackPlan().isEmpty()) {
                recommendations.add("Keep the rollback plan ready: " + state.actionPlan().rollbackPlan().stream()
                        .map(ActionStep::description)
                        .collect(Collectors.joining("; ")));
            }
        }
        if (state.executionResult() != null) {
            sections.put("Execution", state.executionResult().status() + " " + state.executionResult().reason());
            findings.add("Execution status: " + state.executionResult().status());
        }
        if (!state.errors().isEmpty()) {
            sections.put("Errors", state.errors().stream()
                    .map(WorkflowError::message)
                    .collect(Collectors.joining("; ")));
        }
        recommendations.add("Monitor the affected components for the next 30 minutes");

        String subject = state.diagnosticResult() != null ? state.diagnosticResult().rootCause()
                : state.alertInfo() != null ? "alert " + state.alertInfo().id() : "reported incident";
        String outcome = state.executionResult() != null
                ? "remediation finished with status " + state.executionResult().status()
                : "no remediation was executed";
        return new ReportDraft("Incident handled: " + subject + "; " + outcome + ".", sections, findings,
                recommendations);
    }
}
