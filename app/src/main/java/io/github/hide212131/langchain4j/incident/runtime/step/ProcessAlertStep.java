package io.github.hide212131.langchain4j.incident.runtime.step;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterInvoker;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AlertClassifier;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertAnalysis;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classifies the alert and turns it into symptoms for the diagnosis step.
 */
public final class ProcessAlertStep extends AdapterBackedStep {

    private final AlertClassifier classifier;

    public ProcessAlertStep(AlertClassifier classifier, AdapterInvoker invoker, WorkflowLogger logger, Clock clock) {
        super(invoker, logger, clock);
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @Override
    public StepName name() {
        return StepName.PROCESS_ALERT;
    }

    @Override
    Optional<String> missingInput(IncidentState state) {
        return state.hasAlert() ? Optional.empty() : Optional.of("alertInfo");
    }

    @Override
    StepOutcome execute(IncidentState state) {
        AlertInfo alert = state.alertInfo();
        AlertAnalysis analysis = call("alert_classifier", () -> classifier.classify(alert));

        List<String> symptoms = new ArrayList<>();
        symptoms.add(alert.message().isEmpty()
                ? alert.severity() + " " + analysis.category() + " alert " + alert.id()
                : alert.message());
        symptoms.addAll(analysis.correlationHints());

        return StepOutcome.proceed(StateUpdate.by(name())
                .analysis(analysis)
                .addSymptoms(symptoms)
                .message(narrate("Alert " + alert.id() + " classified as " + analysis.category()
                        + " with priority " + analysis.priority() + ".")));
    }
}
