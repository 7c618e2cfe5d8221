package io.github.hide212131.langchain4j.incident.runtime.step;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterFailure;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterInvoker;
import io.github.hide212131.langchain4j.incident.runtime.adapter.ReportGenerator;
import io.github.hide212131.langchain4j.incident.runtime.model.IncidentReport;
import io.github.hide212131.langchain4j.incident.runtime.model.ReportDraft;
import io.github.hide212131.langchain4j.incident.runtime.model.ReportStatus;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import io.github.hide212131.langchain4j.incident.runtime.state.WorkflowError;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Produces the final report. Has no precondition: it also runs for degraded sessions whose
 * earlier steps never succeeded. On its last allowed attempt a failing generator is replaced by a
 * fallback report assembled from the state.
 */
public final class GenerateReportStep extends AdapterBackedStep {

    private final ReportGenerator generator;
    private final int maxAttempts;

    public GenerateReportStep(
            ReportGenerator generator,
            int maxAttempts,
            AdapterInvoker invoker,
            WorkflowLogger logger,
            Clock clock) {
        super(invoker, logger, clock);
        this.generator = Objects.requireNonNull(generator, "generator");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public StepName name() {
        return StepName.GENERATE_REPORT;
    }

    @Override
    Optional<String> missingInput(IncidentState state) {
        return Optional.empty();
    }

    @Override
    StepOutcome execute(IncidentState state) {
        ReportDraft draft;
        try {
            draft = call("report_generator", () -> generator.generate(state));
        } catch (AdapterFailure failure) {
            if (state.failures(name()) + 1 < maxAttempts) {
                throw failure;
            }
            StateUpdate update = failed(state, failure);
            IncidentReport fallback = fallback(state);
            logger.warn("[{}] report generation exhausted; writing fallback report", state.sessionId());
            return StepOutcome.proceed(update
                    .report(fallback)
                    .message(narrate("Report generation failed; a fallback report was written.")));
        }
        IncidentReport report = new IncidentReport(
                incidentId(state),
                title(state),
                draft.summary(),
                draft.sections(),
                draft.keyFindings(),
                draft.recommendations(),
                ReportStatus.GENERATED,
                clock.instant());
        return StepOutcome.proceed(StateUpdate.by(name())
                .report(report)
                .message(narrate("Report ready: " + report.summary())));
    }

    private IncidentReport fallback(IncidentState state) {
        Map<String, String> sections = new LinkedHashMap<>();
        List<String> findings = new ArrayList<>();
        if (state.alertInfo() != null) {
            sections.put("Alert", state.alertInfo().id() + " (" + state.alertInfo().severity() + ")");
        }
        if (state.diagnosticResult() != null) {
            findings.add("Root cause: " + state.diagnosticResult().rootCause());
        }
        if (state.executionResult() != null) {
            findings.add("Execution status: " + state.executionResult().status());
        }
        List<String> errors = new ArrayList<>();
        for (WorkflowError error : state.errors()) {
            errors.add(error.kind() + " in " + error.source() + ": " + error.message());
        }
        if (!errors.isEmpty()) {
            sections.put("Errors", String.join("\n", errors));
        }
        return new IncidentReport(
                incidentId(state),
                title(state),
                "Automatic report generation failed; this report lists the data collected so far.",
                sections,
                findings,
                List.of("Review the incident manually"),
                ReportStatus.FALLBACK,
                clock.instant());
    }

    private static String incidentId(IncidentState state) {
        return state.alertInfo() != null ? state.alertInfo().id() : state.sessionId();
    }

    private static String title(IncidentState state) {
        String subject = state.diagnosticResult() != null ? state.diagnosticResult().rootCause() : "unresolved incident";
        return "Incident " + incidentId(state) + ": " + subject;
    }
}
