package io.github.hide212131.langchain4j.incident.runtime.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.hide212131.langchain4j.incident.runtime.model.AlertAnalysis;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StateMergerTest {

    @Test
    @DisplayName("Result fields are replaced while conversation and errors are appended")
    void overrideVersusAppend() {
        IncidentState state = StateMerger.merge(IncidentState.initial("s"), StateUpdate.by(StepName.DIAGNOSE_ISSUE)
                .diagnosis(diagnosis("d-1"))
                .message(ConversationMessage.assistant("first"))
                .error(WorkflowError.of(ErrorKind.ADAPTER_FAILURE, StepName.DIAGNOSE_ISSUE, "slow")));

        IncidentState merged = StateMerger.merge(state, StateUpdate.by(StepName.DIAGNOSE_ISSUE)
                .diagnosis(diagnosis("d-2"))
                .message(ConversationMessage.assistant("second"))
                .error(WorkflowError.of(ErrorKind.ADAPTER_FAILURE, StepName.DIAGNOSE_ISSUE, "slow again")));

        assertThat(merged.diagnosticResult().diagnosisId()).isEqualTo("d-2");
        assertThat(merged.conversation()).extracting(ConversationMessage::text).containsExactly("first", "second");
        assertThat(merged.errors()).extracting(WorkflowError::message).containsExactly("slow", "slow again");
    }

    @Test
    @DisplayName("Symptoms are unioned and context keys overridden")
    void symptomsAndContext() {
        IncidentState state = IncidentState.builder("s")
                .addSymptoms(List.of("cpu at 97%"))
                .putContext(Map.<String, Object>of("host", "web-1", "team", "platform"))
                .build();

        IncidentState merged = StateMerger.merge(state, StateUpdate.by(StepName.COLLECT_INFO)
                .addSymptoms(List.of("cpu at 97%", " load average 40 "))
                .putContext("host", "web-2"));

        assertThat(merged.symptoms()).containsExactly("cpu at 97%", "load average 40");
        assertThat(merged.context()).containsEntry("host", "web-2").containsEntry("team", "platform");
    }

    @Test
    @DisplayName("A step may not write a result owned by another step")
    void ownershipEnforced() {
        StateUpdate update = StateUpdate.by(StepName.PLAN_ACTIONS).diagnosis(diagnosis("d-1"));

        assertThatThrownBy(() -> StateMerger.merge(IncidentState.initial("s"), update))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("plan_actions")
                .hasMessageContaining("DIAGNOSIS");
    }

    @Test
    @DisplayName("Initialization may pre-populate any result field")
    void initializeWritesAnything() {
        IncidentState merged = StateMerger.merge(IncidentState.initial("s"), StateUpdate.by(StepName.INITIALIZE)
                .analysis(new AlertAnalysis("a-1", "cpu", "high", 0.8, List.of()))
                .diagnosis(diagnosis("d-1")));

        assertThat(merged.analysisResult()).isNotNull();
        assertThat(merged.diagnosticResult()).isNotNull();
    }

    @Test
    @DisplayName("Terminal states accept no further updates")
    void terminalGuard() {
        IncidentState done = IncidentState.initial("s").terminate(SessionStatus.COMPLETED, null);

        assertThatThrownBy(() -> StateMerger.merge(done, StateUpdate.by(StepName.COLLECT_INFO)
                .message(ConversationMessage.user("late"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("terminal");
    }

    @Test
    @DisplayName("Resolved requests are removed before new ones are queued")
    void resolveThenAdd() {
        InformationRequest old = InformationRequest.missing(StepName.COLLECT_INFO, "incident-details", 0);
        InformationRequest fresh = InformationRequest.missing(StepName.COLLECT_INFO, "incident-details", 1);
        IncidentState state = IncidentState.builder("s").addRequest(old).build();

        IncidentState merged = StateMerger.merge(state, StateUpdate.by(StepName.COLLECT_INFO)
                .resolve(old.requestId())
                .request(fresh));

        assertThat(merged.pendingCollection()).containsExactly(fresh);
    }

    @Test
    @DisplayName("A failed update increments the owner's failure counter")
    void failureCounted() {
        IncidentState once = StateMerger.merge(IncidentState.initial("s"), StateUpdate.by(StepName.PROCESS_ALERT).failed());
        IncidentState twice = StateMerger.merge(once, StateUpdate.by(StepName.PROCESS_ALERT).failed());

        assertThat(twice.failures(StepName.PROCESS_ALERT)).isEqualTo(2);
        assertThat(twice.failures(StepName.DIAGNOSE_ISSUE)).isZero();
    }

    @Test
    @DisplayName("Merging returns a new record and leaves the input untouched")
    void inputUnchanged() {
        IncidentState state = IncidentState.initial("s");

        IncidentState merged = StateMerger.merge(state, StateUpdate.by(StepName.COLLECT_INFO)
                .alertInfo(AlertInfo.of("cpu_1", "high")));

        assertThat(merged).isNotSameAs(state);
        assertThat(state.alertInfo()).isNull();
        assertThat(merged.alertInfo().id()).isEqualTo("cpu_1");
    }

    private static Diagnosis diagnosis(String id) {
        return new Diagnosis(id, "cpu saturation", 0.8, List.of(), List.of(), "");
    }
}
