package io.github.hide212131.langchain4j.incident.runtime.state;

import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertAnalysis;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import io.github.hide212131.langchain4j.incident.runtime.model.ExecutionOutcome;
import io.github.hide212131.langchain4j.incident.runtime.model.IncidentReport;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable state record threaded through one session. Every change produces a new instance, which
 * lets the engine hand out snapshots without copying and guarantees that callers never observe a
 * half-applied step.
 */
public record IncidentState(
        String sessionId,
        SessionStatus status,
        List<ConversationMessage> conversation,
        AlertInfo alertInfo,
        List<String> symptoms,
        Map<String, Object> context,
        AlertAnalysis analysisResult,
        Diagnosis diagnosticResult,
        ActionPlan actionPlan,
        ExecutionOutcome executionResult,
        IncidentReport report,
        List<WorkflowError> errors,
        List<InformationRequest> pendingCollection,
        Set<String> requestedSubjects,
        ApprovalRecord approval,
        RoutingDecision routingTrace,
        Map<StepName, Integer> stepFailures,
        int collectionAttempts,
        int cycles,
        Instant createdAt,
        Instant updatedAt) {

    /** Context key under which operator answers accumulate. */
    public static final String OPERATOR_NOTES = "operatorNotes";

    public IncidentState {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must be provided");
        }
        Objects.requireNonNull(status, "status");
        conversation = conversation == null ? List.of() : List.copyOf(conversation);
        symptoms = symptoms == null ? List.of() : List.copyOf(symptoms);
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        errors = errors == null ? List.of() : List.copyOf(errors);
        pendingCollection = pendingCollection == null ? List.of() : List.copyOf(pendingCollection);
        requestedSubjects = requestedSubjects == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(requestedSubjects));
        stepFailures = stepFailures == null || stepFailures.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(stepFailures));
        if (collectionAttempts < 0 || cycles < 0) {
            throw new IllegalArgumentException("counters must not be negative");
        }
        createdAt = createdAt == null ? Instant.now() : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public static IncidentState initial(String sessionId) {
        return builder(sessionId).build();
    }

    public static Builder builder(String sessionId) {
        return new Builder(sessionId);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public boolean hasAlert() {
        return alertInfo != null;
    }

    public boolean hasSymptoms() {
        return !symptoms.isEmpty();
    }

    public boolean hasPendingCollection() {
        return !pendingCollection.isEmpty();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public List<String> operatorNotes() {
        Object notes = context.get(OPERATOR_NOTES);
        List<String> values = new ArrayList<>();
        if (notes instanceof List<?> list) {
            list.forEach(note -> values.add(String.valueOf(note)));
        } else if (notes != null) {
            values.add(notes.toString());
        }
        return values;
    }

    public int failures(StepName step) {
        return stepFailures.getOrDefault(step, 0);
    }

    public boolean alreadyRequested(String subjectId) {
        return subjectId != null && requestedSubjects.contains(subjectId);
    }

    public Optional<ApprovalDecision> approvalFor(String planId) {
        if (approval == null || !approval.appliesTo(planId)) {
            return Optional.empty();
        }
        return Optional.of(approval.decision());
    }

    /**
     * Moves the session to a terminal status, appending the explanatory error and a system notice.
     *
     * @throws IllegalStateException if the session already reached a terminal status
     */
    public IncidentState terminate(SessionStatus terminalStatus, WorkflowError cause) {
        if (!terminalStatus.isTerminal()) {
            throw new IllegalArgumentException("not a terminal status: " + terminalStatus);
        }
        if (isTerminal()) {
            throw new IllegalStateException("Session " + sessionId + " is already terminal: " + status);
        }
        Builder builder = toBuilder().status(terminalStatus);
        if (cause != null) {
            builder.addError(cause);
            builder.addMessage(ConversationMessage.system(cause.message()));
        }
        return builder.build();
    }

    public static final class Builder {
        private final String sessionId;
        private SessionStatus status = SessionStatus.RUNNING;
        private final List<ConversationMessage> conversation = new ArrayList<>();
        private AlertInfo alertInfo;
        private final List<String> symptoms = new ArrayList<>();
        private final Map<String, Object> context = new LinkedHashMap<>();
        private AlertAnalysis analysisResult;
        private Diagnosis diagnosticResult;
        private ActionPlan actionPlan;
        private ExecutionOutcome executionResult;
        private IncidentReport report;
        private final List<WorkflowError> errors = new ArrayList<>();
        private final List<InformationRequest> pendingCollection = new ArrayList<>();
        private final Set<String> requestedSubjects = new LinkedHashSet<>();
        private ApprovalRecord approval;
        private RoutingDecision routingTrace;
        private final Map<StepName, Integer> stepFailures = new EnumMap<>(StepName.class);
        private int collectionAttempts;
        private int cycles;
        private Instant createdAt;

        private Builder(String sessionId) {
            this.sessionId = sessionId;
        }

        private Builder(IncidentState state) {
            this.sessionId = state.sessionId;
            this.status = state.status;
            this.conversation.addAll(state.conversation);
            this.alertInfo = state.alertInfo;
            this.symptoms.addAll(state.symptoms);
            this.context.putAll(state.context);
            this.analysisResult = state.analysisResult;
            this.diagnosticResult = state.diagnosticResult;
            this.actionPlan = state.actionPlan;
            this.executionResult = state.executionResult;
            this.report = state.report;
            this.errors.addAll(state.errors);
            this.pendingCollection.addAll(state.pendingCollection);
            this.requestedSubjects.addAll(state.requestedSubjects);
            this.approval = state.approval;
            this.routingTrace = state.routingTrace;
            this.stepFailures.putAll(state.stepFailures);
            this.collectionAttempts = state.collectionAttempts;
            this.cycles = state.cycles;
            this.createdAt = state.createdAt;
        }

        public Builder status(SessionStatus value) {
            this.status = Objects.requireNonNull(value, "status");
            return this;
        }

        public Builder addMessage(ConversationMessage message) {
            conversation.add(Objects.requireNonNull(message, "message"));
            return this;
        }

        public Builder alertInfo(AlertInfo value) {
            this.alertInfo = value;
            return this;
        }

        /** Adds symptoms that are not yet present, keeping first-seen order. */
        public Builder addSymptoms(List<String> values) {
            for (String value : values) {
                if (value != null && !value.isBlank() && !symptoms.contains(value.trim())) {
                    symptoms.add(value.trim());
                }
            }
            return this;
        }

        public Builder putContext(Map<String, Object> values) {
            context.putAll(values);
            return this;
        }

        public Builder analysisResult(AlertAnalysis value) {
            this.analysisResult = value;
            return this;
        }

        public Builder diagnosticResult(Diagnosis value) {
            this.diagnosticResult = value;
            return this;
        }

        public Builder actionPlan(ActionPlan value) {
            this.actionPlan = value;
            return this;
        }

        public Builder executionResult(ExecutionOutcome value) {
            this.executionResult = value;
            return this;
        }

        public Builder report(IncidentReport value) {
            this.report = value;
            return this;
        }

        public Builder addError(WorkflowError error) {
            errors.add(Objects.requireNonNull(error, "error"));
            return this;
        }

        /** Queues a request unless one with the same id is already pending. */
        public Builder addRequest(InformationRequest request) {
            boolean duplicate = pendingCollection.stream()
                    .anyMatch(existing -> existing.requestId().equals(request.requestId()));
            if (!duplicate) {
                pendingCollection.add(request);
            }
            if (request.subjectId() != null) {
                requestedSubjects.add(request.subjectId());
            }
            return this;
        }

        public Builder resolveRequests(Set<String> requestIds) {
            pendingCollection.removeIf(request -> requestIds.contains(request.requestId()));
            return this;
        }

        public Builder approval(ApprovalRecord value) {
            this.approval = value;
            return this;
        }

        public Builder routingTrace(RoutingDecision value) {
            this.routingTrace = value;
            return this;
        }

        public Builder recordFailure(StepName step) {
            stepFailures.merge(step, 1, Integer::sum);
            return this;
        }

        public Builder collectionAttempts(int value) {
            this.collectionAttempts = value;
            return this;
        }

        public Builder cycles(int value) {
            this.cycles = value;
            return this;
        }

        public IncidentState build() {
            Instant now = Instant.now();
            return new IncidentState(
                    sessionId,
                    status,
                    conversation,
                    alertInfo,
                    symptoms,
                    context,
                    analysisResult,
                    diagnosticResult,
                    actionPlan,
                    executionResult,
                    report,
                    errors,
                    pendingCollection,
                    requestedSubjects,
                    approval,
                    routingTrace,
                    stepFailures,
                    collectionAttempts,
                    cycles,
                    createdAt == null ? now : createdAt,
                    now);
        }
    }
}
