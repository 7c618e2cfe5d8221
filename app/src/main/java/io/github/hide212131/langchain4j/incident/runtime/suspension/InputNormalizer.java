package io.github.hide212131.langchain4j.incident.runtime.suspension;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterFailure;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterInvoker;
import io.github.hide212131.langchain4j.incident.runtime.adapter.TextExtractor;
import io.github.hide212131.langchain4j.incident.runtime.model.ExtractionResult;
import io.github.hide212131.langchain4j.incident.runtime.state.ApprovalDecision;
import io.github.hide212131.langchain4j.incident.runtime.state.ApprovalRecord;
import io.github.hide212131.langchain4j.incident.runtime.state.CollectionPrompt;
import io.github.hide212131.langchain4j.incident.runtime.state.ConversationMessage;
import io.github.hide212131.langchain4j.incident.runtime.state.ErrorKind;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.InformationRequest;
import io.github.hide212131.langchain4j.incident.runtime.state.RequestKind;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import io.github.hide212131.langchain4j.incident.runtime.state.WorkflowError;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns an operator answer into a state update. Accepted inputs are plain text and maps with the
 * fields of {@link OperatorInput}. Anything else is recorded as invalid input. In every case the
 * requests of the answered prompt are resolved, so the router re-evaluates the session from
 * scratch.
 */
public final class InputNormalizer {

    private final TextExtractor extractor;
    private final AdapterInvoker invoker;
    private final ObjectMapper objectMapper;
    private final WorkflowLogger logger;
    private final Clock clock;

    public InputNormalizer(
            TextExtractor extractor,
            AdapterInvoker invoker,
            ObjectMapper objectMapper,
            WorkflowLogger logger,
            Clock clock) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.logger = Objects.requireNonNull(logger, "logger").forComponent(InputNormalizer.class);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public StateUpdate normalize(IncidentState state, CollectionPrompt prompt, Object rawInput) {
        StateUpdate update = StateUpdate.by(StepName.COLLECT_INFO);
        prompt.requests().forEach(request -> update.resolve(request.requestId()));

        if (rawInput instanceof String text) {
            applyText(state, prompt, text, update);
        } else if (rawInput instanceof Map<?, ?> map) {
            applyStructured(state, prompt, map, update);
        } else {
            String type = rawInput == null ? "null" : rawInput.getClass().getSimpleName();
            logger.warn("[{}] unsupported operator input type {}", state.sessionId(), type);
            update.error(WorkflowError.of(ErrorKind.INVALID_INPUT, StepName.COLLECT_INFO,
                    "unsupported input type: " + type));
        }
        return update;
    }

    /**
     * Runs seed text through the extractor the same way an operator answer would be.
     */
    public StateUpdate normalizeSeedText(IncidentState state, String text) {
        StateUpdate update = StateUpdate.by(StepName.INITIALIZE);
        if (text == null || text.isBlank()) {
            return update;
        }
        update.message(ConversationMessage.user(text));
        extractInto(state, text, update);
        return update;
    }

    private void applyText(IncidentState state, CollectionPrompt prompt, String text, StateUpdate update) {
        if (text.isBlank()) {
            update.error(WorkflowError.of(ErrorKind.INVALID_INPUT, StepName.COLLECT_INFO, "empty answer"));
            return;
        }
        String answer = text.trim();
        update.message(ConversationMessage.user(text));
        update.putContext(IncidentState.OPERATOR_NOTES, appendNote(state, answer));

        if (prompt.asksFor(RequestKind.APPROVAL)) {
            Optional<ApprovalDecision> decision = ApprovalDecision.parse(answer);
            if (decision.isPresent()) {
                recordApproval(prompt, decision.get(), update);
                return;
            }
            update.error(WorkflowError.of(ErrorKind.INVALID_INPUT, StepName.COLLECT_INFO,
                    "answer is not approve, reject or modify: " + answer));
        }
        extractInto(state, answer, update);
    }

    private void applyStructured(IncidentState state, CollectionPrompt prompt, Map<?, ?> raw, StateUpdate update) {
        OperatorInput input;
        try {
            input = objectMapper.convertValue(raw, OperatorInput.class);
        } catch (IllegalArgumentException e) {
            logger.warn("[{}] rejected structured input: {}", state.sessionId(), e.getMessage());
            update.error(WorkflowError.of(ErrorKind.INVALID_INPUT, StepName.COLLECT_INFO,
                    "unrecognised structured input: " + firstLine(e.getMessage())));
            return;
        }
        update.message(ConversationMessage.user(String.valueOf(raw)));
        if (input.alertInfo() != null) {
            if (state.hasAlert()) {
                logger.warn("[{}] ignored alert {}: session already tracks alert {}", state.sessionId(),
                        input.alertInfo().id(), state.alertInfo().id());
                update.error(WorkflowError.of(ErrorKind.INVALID_INPUT, StepName.COLLECT_INFO,
                        "alert " + input.alertInfo().id() + " ignored; session already tracks alert "
                                + state.alertInfo().id()));
            } else {
                update.alertInfo(input.alertInfo());
            }
        }
        if (input.symptoms() != null) {
            update.addSymptoms(input.symptoms());
        }
        if (input.context() != null) {
            update.putContext(input.context());
        }
        if (input.approval() != null) {
            Optional<ApprovalDecision> decision = ApprovalDecision.parse(input.approval());
            if (decision.isPresent()) {
                recordApproval(prompt, decision.get(), update);
            } else {
                update.error(WorkflowError.of(ErrorKind.INVALID_INPUT, StepName.COLLECT_INFO,
                        "approval is not approve, reject or modify: " + input.approval()));
            }
        }
        if (input.answer() != null && !input.answer().isBlank()) {
            update.putContext(IncidentState.OPERATOR_NOTES, appendNote(state, input.answer().trim()));
        }
    }

    private void extractInto(IncidentState state, String text, StateUpdate update) {
        ExtractionResult extraction;
        try {
            extraction = invoker.invoke("text_extractor", () -> extractor.extract(text));
        } catch (AdapterFailure failure) {
            update.error(WorkflowError.of(ErrorKind.ADAPTER_FAILURE, StepName.COLLECT_INFO, failure.describe()));
            return;
        }
        if (!extraction.hasFindings()) {
            logger.debug("[{}] extractor found nothing in operator input", state.sessionId());
            return;
        }
        if (extraction.alertInfo() != null) {
            if (state.hasAlert()) {
                logger.info("[{}] extracted alert {} not applied; session already tracks alert {}",
                        state.sessionId(), extraction.alertInfo().id(), state.alertInfo().id());
            } else {
                update.alertInfo(extraction.alertInfo());
            }
        }
        update.addSymptoms(extraction.symptoms());
        update.putContext(extraction.context());
    }

    private void recordApproval(CollectionPrompt prompt, ApprovalDecision decision, StateUpdate update) {
        for (InformationRequest request : prompt.requests()) {
            if (request.kind() == RequestKind.APPROVAL && request.subjectId() != null) {
                update.approval(new ApprovalRecord(request.subjectId(), decision, clock.instant()));
            }
        }
    }

    private static List<String> appendNote(IncidentState state, String note) {
        List<String> notes = new ArrayList<>(state.operatorNotes());
        notes.add(note);
        return notes;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
