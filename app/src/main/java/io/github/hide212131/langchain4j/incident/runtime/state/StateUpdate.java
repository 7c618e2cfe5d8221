package io.github.hide212131.langchain4j.incident.runtime.state;

import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertAnalysis;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import io.github.hide212131.langchain4j.incident.runtime.model.ExecutionOutcome;
import io.github.hide212131.langchain4j.incident.runtime.model.IncidentReport;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Partial update returned by a step. Nothing is applied until {@link StateMerger#merge} runs, so a
 * step that throws half way leaves the session untouched.
 */
public final class StateUpdate {

    private final StepName owner;
    private final Map<ResultField, Object> results = new EnumMap<>(ResultField.class);
    private AlertInfo alertInfo;
    private final List<String> symptoms = new ArrayList<>();
    private final Map<String, Object> context = new LinkedHashMap<>();
    private final List<ConversationMessage> messages = new ArrayList<>();
    private final List<WorkflowError> errors = new ArrayList<>();
    private final List<InformationRequest> requests = new ArrayList<>();
    private final Set<String> resolvedRequests = new LinkedHashSet<>();
    private ApprovalRecord approval;
    private boolean failed;

    private StateUpdate(StepName owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public static StateUpdate by(StepName owner) {
        return new StateUpdate(owner);
    }

    public StateUpdate analysis(AlertAnalysis value) {
        results.put(ResultField.ANALYSIS, Objects.requireNonNull(value, "analysis"));
        return this;
    }

    public StateUpdate diagnosis(Diagnosis value) {
        results.put(ResultField.DIAGNOSIS, Objects.requireNonNull(value, "diagnosis"));
        return this;
    }

    public StateUpdate plan(ActionPlan value) {
        results.put(ResultField.PLAN, Objects.requireNonNull(value, "plan"));
        return this;
    }

    public StateUpdate execution(ExecutionOutcome value) {
        results.put(ResultField.EXECUTION, Objects.requireNonNull(value, "execution"));
        return this;
    }

    public StateUpdate report(IncidentReport value) {
        results.put(ResultField.REPORT, Objects.requireNonNull(value, "report"));
        return this;
    }

    public StateUpdate alertInfo(AlertInfo value) {
        this.alertInfo = value;
        return this;
    }

    public StateUpdate addSymptoms(List<String> values) {
        symptoms.addAll(values);
        return this;
    }

    public StateUpdate putContext(String key, Object value) {
        context.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    public StateUpdate putContext(Map<String, Object> values) {
        context.putAll(values);
        return this;
    }

    public StateUpdate message(ConversationMessage message) {
        messages.add(Objects.requireNonNull(message, "message"));
        return this;
    }

    public StateUpdate error(WorkflowError error) {
        errors.add(Objects.requireNonNull(error, "error"));
        return this;
    }

    public StateUpdate request(InformationRequest request) {
        requests.add(Objects.requireNonNull(request, "request"));
        return this;
    }

    public StateUpdate resolve(String requestId) {
        resolvedRequests.add(Objects.requireNonNull(requestId, "requestId"));
        return this;
    }

    public StateUpdate approval(ApprovalRecord value) {
        this.approval = value;
        return this;
    }

    /** Counts one failed attempt against the owning step. */
    public StateUpdate failed() {
        this.failed = true;
        return this;
    }

    public StepName owner() {
        return owner;
    }

    public Map<ResultField, Object> results() {
        return Collections.unmodifiableMap(results);
    }

    public AlertInfo alertInfo() {
        return alertInfo;
    }

    public List<String> symptoms() {
        return List.copyOf(symptoms);
    }

    public Map<String, Object> context() {
        return Collections.unmodifiableMap(context);
    }

    public List<ConversationMessage> messages() {
        return List.copyOf(messages);
    }

    public List<WorkflowError> errors() {
        return List.copyOf(errors);
    }

    public List<InformationRequest> requests() {
        return List.copyOf(requests);
    }

    public Set<String> resolvedRequests() {
        return Collections.unmodifiableSet(resolvedRequests);
    }

    public ApprovalRecord approval() {
        return approval;
    }

    public boolean isFailed() {
        return failed;
    }

    public boolean isEmpty() {
        return results.isEmpty()
                && alertInfo == null
                && symptoms.isEmpty()
                && context.isEmpty()
                && messages.isEmpty()
                && errors.isEmpty()
                && requests.isEmpty()
                && resolvedRequests.isEmpty()
                && approval == null
                && !failed;
    }
}
