package io.github.hide212131.langchain4j.incident.runtime.step;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.runtime.state.CollectionPrompt;
import io.github.hide212131.langchain4j.incident.runtime.state.ConversationMessage;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.InformationRequest;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns the pending information requests into an operator prompt and suspends the session.
 */
public final class CollectInfoStep implements WorkflowStep {

    private final WorkflowLogger logger;

    public CollectInfoStep(WorkflowLogger logger) {
        this.logger = Objects.requireNonNull(logger, "logger").forComponent(CollectInfoStep.class);
    }

    @Override
    public StepName name() {
        return StepName.COLLECT_INFO;
    }

    @Override
    public StepOutcome run(IncidentState state) {
        StateUpdate update = StateUpdate.by(name());
        List<InformationRequest> requests = new ArrayList<>(state.pendingCollection());
        if (requests.isEmpty()) {
            InformationRequest request = InformationRequest.missing(name(), "incident-details", state.collectionAttempts());
            update.request(request);
            requests.add(request);
        }
        String message = requests.stream()
                .map(InformationRequest::question)
                .collect(Collectors.joining("\n"));
        logger.debug("[{}] asking operator for {} item(s)", state.sessionId(), requests.size());
        update.message(ConversationMessage.assistant(message));
        return StepOutcome.suspend(update, new CollectionPrompt(message, requests));
    }
}
