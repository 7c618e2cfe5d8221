package io.github.hide212131.langchain4j.incident.runtime.step;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterInvoker;
import io.github.hide212131.langchain4j.incident.runtime.adapter.DiagnosticEngine;
import io.github.hide212131.langchain4j.incident.runtime.adapter.DiagnosticRequest;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Asks the diagnostic engine for a root cause. Re-running the step replaces the previous
 * diagnosis, which is how operator clarifications are taken into account.
 *
 * <p>A diagnosis whose id was already clarified gets a new id, so a low-confidence answer after a
 * clarification leads to another request instead of an immediate re-run.</p>
 */
public final class DiagnoseIssueStep extends AdapterBackedStep {

    private final DiagnosticEngine engine;

    public DiagnoseIssueStep(DiagnosticEngine engine, AdapterInvoker invoker, WorkflowLogger logger, Clock clock) {
        super(invoker, logger, clock);
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public StepName name() {
        return StepName.DIAGNOSE_ISSUE;
    }

    @Override
    Optional<String> missingInput(IncidentState state) {
        if (state.hasSymptoms() || state.hasAlert() || !state.operatorNotes().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("symptoms");
    }

    @Override
    StepOutcome execute(IncidentState state) {
        DiagnosticRequest request = new DiagnosticRequest(
                state.symptoms(),
                state.context(),
                state.alertInfo(),
                state.analysisResult(),
                state.operatorNotes());
        Diagnosis diagnosis = call("diagnostic_engine", () -> engine.diagnose(request));
        if (state.alreadyRequested(diagnosis.diagnosisId())) {
            String reissued = UUID.randomUUID().toString();
            logger.debug("[{}] diagnosis id {} was already clarified; using {}", state.sessionId(),
                    diagnosis.diagnosisId(), reissued);
            diagnosis = diagnosis.withDiagnosisId(reissued);
        }
        return StepOutcome.proceed(StateUpdate.by(name())
                .diagnosis(diagnosis)
                .message(narrate(String.format(Locale.ROOT, "Likely root cause: %s (confidence %.2f).",
                        diagnosis.rootCause(), diagnosis.confidenceScore()))));
    }
}
