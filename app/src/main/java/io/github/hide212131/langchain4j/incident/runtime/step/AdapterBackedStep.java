package io.github.hide212131.langchain4j.incident.runtime.step;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterCall;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterFailure;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterInvoker;
import io.github.hide212131.langchain4j.incident.runtime.state.ConversationMessage;
import io.github.hide212131.langchain4j.incident.runtime.state.ErrorKind;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.InformationRequest;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import io.github.hide212131.langchain4j.incident.runtime.state.WorkflowError;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Common shape of the business steps: check the precondition, call one adapter through the
 * shared invoker, and turn adapter failures into error entries.
 */
abstract class AdapterBackedStep implements WorkflowStep {

    private final AdapterInvoker invoker;
    final WorkflowLogger logger;
    final Clock clock;

    AdapterBackedStep(AdapterInvoker invoker, WorkflowLogger logger, Clock clock) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.logger = Objects.requireNonNull(logger, "logger").forComponent(getClass());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Name of the state field this step cannot run without, or empty when it can run. */
    abstract Optional<String> missingInput(IncidentState state);

    abstract StepOutcome execute(IncidentState state);

    @Override
    public final StepOutcome run(IncidentState state) {
        Optional<String> missing = missingInput(state);
        if (missing.isPresent()) {
            String field = missing.get();
            logger.info("[{}] {} cannot run: {} is missing", state.sessionId(), name(), field);
            return StepOutcome.proceed(StateUpdate.by(name())
                    .error(WorkflowError.of(ErrorKind.PRECONDITION_MISSING, name(), field + " is required"))
                    .request(InformationRequest.missing(name(), field, state.collectionAttempts())));
        }
        try {
            return execute(state);
        } catch (AdapterFailure failure) {
            return StepOutcome.proceed(failed(state, failure));
        }
    }

    <T> T call(String adapter, AdapterCall<T> call) {
        return invoker.invoke(adapter, call);
    }

    StateUpdate failed(IncidentState state, AdapterFailure failure) {
        logger.warn("[{}] {} attempt {} failed: {}", state.sessionId(), name(), state.failures(name()) + 1,
                failure.describe());
        return StateUpdate.by(name())
                .error(WorkflowError.of(ErrorKind.ADAPTER_FAILURE, name(), failure.describe()))
                .failed();
    }

    static ConversationMessage narrate(String text) {
        return ConversationMessage.assistant(text);
    }
}
