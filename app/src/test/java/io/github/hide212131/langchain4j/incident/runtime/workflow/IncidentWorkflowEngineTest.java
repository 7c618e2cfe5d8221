package io.github.hide212131.langchain4j.incident.runtime.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.hide212131.langchain4j.incident.runtime.MutableClock;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterException;
import io.github.hide212131.langchain4j.incident.runtime.adapter.ExecutionBackend;
import io.github.hide212131.langchain4j.incident.runtime.adapter.ReasoningAdapters;
import io.github.hide212131.langchain4j.incident.runtime.adapter.rules.KeywordAlertClassifier;
import io.github.hide212131.langchain4j.incident.runtime.adapter.rules.SimulatedExecutionBackend;
import io.github.hide212131.langchain4j.incident.runtime.config.EngineSettings;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import io.github.hide212131.langchain4j.incident.runtime.model.ExecutionOutcome;
import io.github.hide212131.langchain4j.incident.runtime.model.ExecutionStatus;
import io.github.hide212131.langchain4j.incident.runtime.model.ReportStatus;
import io.github.hide212131.langchain4j.incident.runtime.state.ApprovalDecision;
import io.github.hide212131.langchain4j.incident.runtime.state.ConversationMessage;
import io.github.hide212131.langchain4j.incident.runtime.state.ErrorKind;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.RequestKind;
import io.github.hide212131.langchain4j.incident.runtime.state.SessionStatus;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import io.github.hide212131.langchain4j.incident.runtime.state.WorkflowError;
import io.github.hide212131.langchain4j.incident.runtime.step.StepOutcome;
import io.github.hide212131.langchain4j.incident.runtime.step.WorkflowStep;
import io.github.hide212131.langchain4j.incident.runtime.suspension.Checkpoint;
import io.github.hide212131.langchain4j.incident.runtime.suspension.CheckpointStore;
import io.github.hide212131.langchain4j.incident.runtime.suspension.InMemoryCheckpointStore;
import io.github.hide212131.langchain4j.incident.runtime.suspension.ResumptionToken;
import io.github.hide212131.langchain4j.incident.runtime.suspension.UnknownTokenException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IncidentWorkflowEngineTest {

    private final List<IncidentWorkflowEngine> engines = new ArrayList<>();

    @AfterEach
    void closeEngines() {
        engines.forEach(IncidentWorkflowEngine::close);
    }

    @Test
    @DisplayName("A high CPU alert runs through every business step and completes in five cycles")
    void cpuAlertCompletes() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());

        RunResult result = engine.start(SessionSeed.ofAlert(AlertInfo.of("cpu_1", "high")));

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(stages(result)).containsExactly(
                "process_alert", "diagnose_issue", "plan_actions", "execute_actions", "generate_report");
        assertThat(result.visitedStages()).extracting(StageVisit::attempt).containsExactly(1, 2, 3, 4, 5);
        assertThat(state.cycles()).isEqualTo(5);
        assertThat(state.analysisResult().category()).isEqualTo("cpu");
        assertThat(state.diagnosticResult().rootCause()).isEqualTo("cpu saturation");
        assertThat(state.diagnosticResult().confidenceScore()).isCloseTo(0.75, within(1e-9));
        assertThat(state.executionResult().status()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(state.report().status()).isEqualTo(ReportStatus.GENERATED);
        assertThat(state.report().title()).isEqualTo("Incident cpu_1: cpu saturation");
        assertThat(state.errors()).isEmpty();
        assertThat(state.routingTrace().nextStep()).isEqualTo(StepName.TERMINAL);
        assertThat(engine.activeSessionIds()).isEmpty();
    }

    @Test
    @DisplayName("A free-text description is extracted into an alert before routing")
    void naturalLanguageSeed() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());

        RunResult result = engine.start(SessionSeed.ofText("CPU high on web-1"));

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(stages(result)).first().isEqualTo("process_alert");
        assertThat(state.alertInfo().source()).isEqualTo("web-1");
        assertThat(state.alertInfo().severity()).isEqualTo("high");
        assertThat(state.context()).containsEntry("host", "web-1");
        assertThat(state.conversation().get(0).role()).isEqualTo(ConversationMessage.Role.USER);
        assertThat(state.diagnosticResult().affectedComponents()).contains("web-1");
    }

    @Test
    @DisplayName("An empty seed suspends with a request for incident details")
    void emptySeedSuspends() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());

        RunResult result = engine.start(SessionSeed.empty().withSessionId("s-empty"));

        assertThat(result).isInstanceOf(RunResult.Waiting.class);
        RunResult.Waiting waiting = (RunResult.Waiting) result;
        assertThat(waiting.sessionId()).isEqualTo("s-empty");
        assertThat(waiting.prompt().requests()).extracting(r -> r.requestId())
                .containsExactly("missing:incident-details#0");
        assertThat(waiting.state().status()).isEqualTo(SessionStatus.WAITING);
        assertThat(waiting.state().collectionAttempts()).isEqualTo(1);
        assertThat(engine.pendingCheckpoint("s-empty")).isPresent();
        assertThat(engine.activeSessionIds()).containsExactly("s-empty");
    }

    @Test
    @DisplayName("Resuming with a usable description finishes the session")
    void resumeWithDescription() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());
        RunResult.Waiting waiting = (RunResult.Waiting) engine.start(SessionSeed.empty());

        RunResult result = engine.resume(waiting.token(), "disk full on db-2, error writing WAL");

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(stages(result)).startsWith("collect_info", "process_alert");
        assertThat(state.pendingCollection()).isEmpty();
        assertThat(state.operatorNotes()).containsExactly("disk full on db-2, error writing WAL");
        assertThat(engine.pendingCheckpoint(state.sessionId())).isEmpty();
    }

    @Test
    @DisplayName("A token can only be resumed once")
    void tokenIsSingleUse() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());
        RunResult.Waiting waiting = (RunResult.Waiting) engine.start(SessionSeed.empty());
        RunResult result = engine.resume(waiting.token(), "CPU high on web-1");

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(stages(result)).startsWith("collect_info", "process_alert");
        assertThat(state.alertInfo()).isNotNull();
        assertThat(state.alertInfo().source()).isEqualTo("web-1");
        assertThat(state.alertInfo().severity()).isEqualTo("high");
        assertThatThrownBy(() -> engine.resume(waiting.token(), "again"))
                .isInstanceOf(UnknownTokenException.class);
    }

    @Test
    @DisplayName("Resume input is appended to the conversation exactly as given")
    void resumeInputKeptVerbatim() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());
        RunResult.Waiting waiting = (RunResult.Waiting) engine.start(SessionSeed.empty());
        String typed = "  CPU high on web-1\n";

        RunResult result = engine.resume(waiting.token(), typed);

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(state.conversation()).filteredOn(message -> message.role() == ConversationMessage.Role.USER)
                .extracting(ConversationMessage::text)
                .containsExactly(typed);
        assertThat(state.operatorNotes()).containsExactly("CPU high on web-1");
    }

    @Test
    @DisplayName("Unusable answers exhaust the collection cap on the fifth resume")
    void collectionExhaustion() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());

        RunResult result = engine.start(SessionSeed.empty());
        int resumes = 0;
        while (result instanceof RunResult.Waiting waiting) {
            resumes++;
            result = engine.resume(waiting.token(), "hello");
        }

        IncidentState state = completed(result, SessionStatus.COLLECTION_EXHAUSTED);
        assertThat(resumes).isEqualTo(5);
        assertThat(state.collectionAttempts()).isEqualTo(5);
        assertThat(state.errors()).extracting(WorkflowError::kind).contains(ErrorKind.SUSPENSION_EXHAUSTED);
        assertThat(state.report()).isNull();
        assertThat(engine.activeSessionIds()).isEmpty();
    }

    @Test
    @DisplayName("A low-confidence diagnosis asks for clarification and is diagnosed again")
    void clarificationLoop() {
        AtomicInteger diagnoses = new AtomicInteger();
        ReasoningAdapters adapters = ReasoningAdapters.ruleBased().withDiagnosticEngine(request -> {
            if (diagnoses.incrementAndGet() == 1) {
                return new Diagnosis("d-1", "unclear", 0.4, List.of(), List.of(), "unknown");
            }
            return new Diagnosis("d-2", "cpu saturation", 0.85, List.of("web-1"), request.operatorNotes(), "slow");
        });
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), adapters);

        RunResult first = engine.start(SessionSeed.ofAlert(AlertInfo.of("cpu_1", "high")));

        assertThat(first).isInstanceOf(RunResult.Waiting.class);
        RunResult.Waiting waiting = (RunResult.Waiting) first;
        assertThat(waiting.prompt().asksFor(RequestKind.CLARIFICATION)).isTrue();
        assertThat(waiting.prompt().requests().get(0).requestId()).isEqualTo("clarify:d-1");

        RunResult result = engine.resume(waiting.token(), "load spiked right after the deploy");

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(diagnoses).hasValue(2);
        assertThat(stages(result)).containsExactly("process_alert", "diagnose_issue", "collect_info",
                "diagnose_issue", "plan_actions", "execute_actions", "generate_report");
        assertThat(state.diagnosticResult().diagnosisId()).isEqualTo("d-2");
        assertThat(state.diagnosticResult().evidence()).containsExactly("load spiked right after the deploy");
    }

    @Test
    @DisplayName("A diagnostic engine that repeats its id is asked about again on every re-diagnosis")
    void repeatedDiagnosisIdStillSuspends() {
        AtomicInteger diagnoses = new AtomicInteger();
        ReasoningAdapters adapters = ReasoningAdapters.ruleBased().withDiagnosticEngine(request -> {
            diagnoses.incrementAndGet();
            return new Diagnosis("d-1", "unclear", 0.4, List.of(), List.of(), "unknown");
        });
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), adapters);

        RunResult result = engine.start(SessionSeed.ofAlert(AlertInfo.of("cpu_1", "high")));
        List<String> clarifications = new ArrayList<>();
        int resumes = 0;
        while (result instanceof RunResult.Waiting waiting) {
            assertThat(waiting.prompt().asksFor(RequestKind.CLARIFICATION)).isTrue();
            clarifications.add(waiting.prompt().requests().get(0).requestId());
            resumes++;
            result = engine.resume(waiting.token(), "more detail");
        }

        IncidentState state = completed(result, SessionStatus.COLLECTION_EXHAUSTED);
        assertThat(resumes).isEqualTo(5);
        assertThat(diagnoses).hasValue(6);
        assertThat(clarifications).doesNotHaveDuplicates().first().isEqualTo("clarify:d-1");
        assertThat(state.cycles()).isLessThan(EngineSettings.defaults().maxCycles());
    }

    @Test
    @DisplayName("A disruptive plan waits for approval and runs once approved")
    void approvedPlanRuns() {
        CountingBackend backend = new CountingBackend();
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(),
                ReasoningAdapters.ruleBased().withExecutionBackend(backend));

        RunResult first = engine.start(SessionSeed.ofAlert(AlertInfo.of("memory_1", "high")));

        assertThat(first).isInstanceOf(RunResult.Waiting.class);
        RunResult.Waiting waiting = (RunResult.Waiting) first;
        assertThat(waiting.prompt().asksFor(RequestKind.APPROVAL)).isTrue();
        assertThat(waiting.state().actionPlan().riskLevel()).isEqualTo("high");
        assertThat(backend.calls).hasValue(0);

        RunResult result = engine.resume(waiting.token(), "approve");

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(backend.calls).hasValue(1);
        assertThat(state.approval().decision()).isEqualTo(ApprovalDecision.APPROVED);
        assertThat(state.executionResult().status()).isEqualTo(ExecutionStatus.SUCCESS);
    }

    @Test
    @DisplayName("A rejected plan is reported without touching the execution backend")
    void rejectedPlanIsNotExecuted() {
        CountingBackend backend = new CountingBackend();
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(),
                ReasoningAdapters.ruleBased().withExecutionBackend(backend));
        RunResult.Waiting waiting = (RunResult.Waiting) engine.start(SessionSeed.ofAlert(AlertInfo.of("memory_1", "high")));

        RunResult result = engine.resume(waiting.token(), "reject, restart is too risky now");

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(backend.calls).hasValue(0);
        assertThat(state.executionResult().status()).isEqualTo(ExecutionStatus.REJECTED_BY_OPERATOR);
        assertThat(state.report()).isNotNull();
    }

    @Test
    @DisplayName("An unparseable approval answer is recorded and the approval is asked again")
    void unclearApprovalAsksAgain() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());
        RunResult.Waiting waiting = (RunResult.Waiting) engine.start(SessionSeed.ofAlert(AlertInfo.of("memory_1", "high")));

        RunResult result = engine.resume(waiting.token(), "maybe later");

        assertThat(result).isInstanceOf(RunResult.Waiting.class);
        RunResult.Waiting again = (RunResult.Waiting) result;
        assertThat(again.prompt().asksFor(RequestKind.APPROVAL)).isTrue();
        assertThat(again.state().errors()).extracting(WorkflowError::kind).contains(ErrorKind.INVALID_INPUT);
        assertThat(again.state().executionResult()).isNull();
    }

    @Test
    @DisplayName("Plans are not executed without approval when automatic execution is off")
    void autoExecutionDisabled() {
        IncidentWorkflowEngine engine = engine(EngineSettings.builder().autoExecution(false).build(),
                ReasoningAdapters.ruleBased());

        RunResult result = engine.start(SessionSeed.ofAlert(AlertInfo.of("cpu_1", "high")));

        assertThat(result).isInstanceOf(RunResult.Waiting.class);
        assertThat(((RunResult.Waiting) result).prompt().asksFor(RequestKind.APPROVAL)).isTrue();
    }

    @Test
    @DisplayName("A structured answer can supply the alert and symptoms")
    void structuredResume() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());
        RunResult.Waiting waiting = (RunResult.Waiting) engine.start(SessionSeed.empty());

        RunResult result = engine.resume(waiting.token(), Map.of(
                "alertInfo", Map.of("id", "disk_7", "severity", "critical", "source", "db-2"),
                "symptoms", List.of("disk volume at 99% on db-2")));

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(state.alertInfo().id()).isEqualTo("disk_7");
        assertThat(state.diagnosticResult().rootCause()).isEqualTo("disk capacity exhausted");
    }

    @Test
    @DisplayName("A classifier that keeps timing out degrades to a report after the retry bound")
    void adapterTimeoutDegradesToReport() {
        ReasoningAdapters adapters = ReasoningAdapters.ruleBased().withAlertClassifier(alert -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AdapterException("interrupted", e);
            }
            throw new AdapterException("unreachable");
        });
        IncidentWorkflowEngine engine = engine(
                EngineSettings.builder().adapterTimeout(Duration.ofMillis(100)).build(), adapters);

        RunResult result = engine.start(SessionSeed.ofAlert(AlertInfo.of("cpu_1", "high")));

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(stages(result)).containsExactly("process_alert", "process_alert", "process_alert",
                "generate_report");
        assertThat(state.failures(StepName.PROCESS_ALERT)).isEqualTo(3);
        assertThat(state.errors()).filteredOn(error -> error.kind() == ErrorKind.ADAPTER_FAILURE).hasSize(3)
                .allSatisfy(error -> assertThat(error.message()).contains("timeout"));
        assertThat(state.analysisResult()).isNull();
        assertThat(state.report()).isNotNull();
    }

    @Test
    @DisplayName("A failing report generator ends with a fallback report")
    void fallbackReport() {
        AtomicInteger attempts = new AtomicInteger();
        ReasoningAdapters adapters = ReasoningAdapters.ruleBased().withReportGenerator(state -> {
            attempts.incrementAndGet();
            throw new AdapterException("template engine unavailable");
        });
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), adapters);

        RunResult result = engine.start(SessionSeed.ofAlert(AlertInfo.of("cpu_1", "high")));

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(attempts).hasValue(3);
        assertThat(state.report().status()).isEqualTo(ReportStatus.FALLBACK);
        assertThat(state.report().keyFindings()).contains("Root cause: cpu saturation");
        assertThat(state.failures(StepName.GENERATE_REPORT)).isEqualTo(3);
    }

    @Test
    @DisplayName("A step that throws is recorded as a step failure and routed around")
    void throwingStepIsContained() {
        WorkflowStep broken = new WorkflowStep() {
            @Override
            public StepName name() {
                return StepName.PLAN_ACTIONS;
            }

            @Override
            public StepOutcome run(IncidentState state) {
                throw new IllegalStateException("planner misconfigured");
            }
        };
        IncidentWorkflowEngine engine = IncidentWorkflowEngine.builder().step(broken).build();
        engines.add(engine);

        RunResult result = engine.start(SessionSeed.ofAlert(AlertInfo.of("cpu_1", "high")));

        IncidentState state = completed(result, SessionStatus.COMPLETED);
        assertThat(state.errors()).filteredOn(error -> error.kind() == ErrorKind.STEP_FAILURE).hasSize(3)
                .allSatisfy(error -> assertThat(error.message()).contains("planner misconfigured"));
        assertThat(state.actionPlan()).isNull();
        assertThat(state.report()).isNotNull();
    }

    @Test
    @DisplayName("The cycle limit force-terminates a session")
    void cycleLimit() {
        IncidentWorkflowEngine engine = engine(EngineSettings.builder().maxCycles(3).build(),
                ReasoningAdapters.ruleBased());

        RunResult result = engine.start(SessionSeed.ofAlert(AlertInfo.of("cpu_1", "high")));

        IncidentState state = completed(result, SessionStatus.CYCLE_LIMIT_EXCEEDED);
        assertThat(state.cycles()).isEqualTo(3);
        assertThat(state.errors()).extracting(WorkflowError::kind).containsExactly(ErrorKind.CYCLE_LIMIT_EXCEEDED);
        assertThat(state.conversation()).last().extracting(ConversationMessage::role)
                .isEqualTo(ConversationMessage.Role.SYSTEM);
    }

    @Test
    @DisplayName("A drive that exceeds the run duration ends with a session timeout")
    void sessionTimeout() {
        MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        KeywordAlertClassifier classifier = new KeywordAlertClassifier();
        ReasoningAdapters adapters = ReasoningAdapters.ruleBased().withAlertClassifier(alert -> {
            clock.advance(Duration.ofMinutes(11));
            return classifier.classify(alert);
        });
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), adapters, clock);

        RunResult result = engine.start(SessionSeed.ofAlert(AlertInfo.of("cpu_1", "high")));

        IncidentState state = completed(result, SessionStatus.SESSION_TIMEOUT);
        assertThat(state.analysisResult()).isNotNull();
        assertThat(state.errors()).extracting(WorkflowError::kind).containsExactly(ErrorKind.SESSION_TIMEOUT);
    }

    @Test
    @DisplayName("Cancelling a waiting session invalidates its token")
    void cancelWaitingSession() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());
        RunResult.Waiting waiting = (RunResult.Waiting) engine.start(SessionSeed.empty());

        assertThat(engine.cancel(waiting.sessionId())).isTrue();

        assertThat(engine.activeSessionIds()).isEmpty();
        assertThat(engine.pendingCheckpoint(waiting.sessionId())).isEmpty();
        assertThat(engine.cancel(waiting.sessionId())).isFalse();
        assertThatThrownBy(() -> engine.resume(waiting.token(), "CPU high on web-1"))
                .isInstanceOf(UnknownTokenException.class);
    }

    @Test
    @DisplayName("A cancel that lands while the checkpoint is being saved leaves no checkpoint behind")
    void cancelDuringSuspension() {
        AtomicReference<IncidentWorkflowEngine> engineRef = new AtomicReference<>();
        InMemoryCheckpointStore delegate = new InMemoryCheckpointStore();
        CheckpointStore cancellingStore = new CheckpointStore() {
            @Override
            public void save(Checkpoint checkpoint) {
                engineRef.get().cancel(checkpoint.sessionId());
                delegate.save(checkpoint);
            }

            @Override
            public Optional<Checkpoint> remove(ResumptionToken token) {
                return delegate.remove(token);
            }

            @Override
            public Optional<Checkpoint> findBySession(String sessionId) {
                return delegate.findBySession(sessionId);
            }

            @Override
            public Optional<Checkpoint> removeBySession(String sessionId) {
                return delegate.removeBySession(sessionId);
            }

            @Override
            public List<Checkpoint> all() {
                return delegate.all();
            }
        };
        IncidentWorkflowEngine engine = IncidentWorkflowEngine.builder()
                .settings(EngineSettings.defaults())
                .adapters(ReasoningAdapters.ruleBased())
                .checkpointStore(cancellingStore)
                .build();
        engines.add(engine);
        engineRef.set(engine);

        RunResult result = engine.start(SessionSeed.empty().withSessionId("s-race"));

        assertThat(result).isInstanceOf(RunResult.Cancelled.class);
        assertThat(result.sessionId()).isEqualTo("s-race");
        assertThat(delegate.all()).isEmpty();
        assertThat(engine.pendingCheckpoint("s-race")).isEmpty();
        assertThat(engine.activeSessionIds()).isEmpty();
    }

    @Test
    @DisplayName("Idle checkpoints expire after the TTL")
    void checkpointExpiry() {
        MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased(), clock);
        RunResult.Waiting waiting = (RunResult.Waiting) engine.start(SessionSeed.empty());

        clock.advance(Duration.ofMinutes(10));
        assertThat(engine.expireIdleCheckpoints()).isEmpty();

        clock.advance(Duration.ofMinutes(21));
        assertThat(engine.expireIdleCheckpoints()).containsExactly(waiting.sessionId());
        assertThat(engine.activeSessionIds()).isEmpty();
        assertThatThrownBy(() -> engine.resume(waiting.token(), "CPU high on web-1"))
                .isInstanceOf(UnknownTokenException.class);
    }

    @Test
    @DisplayName("Resuming after the TTL is rejected even before a sweep")
    void lateResumeRejected() {
        MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased(), clock);
        RunResult.Waiting waiting = (RunResult.Waiting) engine.start(SessionSeed.empty());

        clock.advance(Duration.ofHours(1));

        assertThatThrownBy(() -> engine.resume(waiting.token(), "CPU high on web-1"))
                .isInstanceOf(UnknownTokenException.class);
        assertThat(engine.activeSessionIds()).isEmpty();
    }

    @Test
    @DisplayName("Starting a session id that is still active is rejected")
    void duplicateSessionId() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());
        engine.start(SessionSeed.empty().withSessionId("dup"));

        assertThatThrownBy(() -> engine.start(SessionSeed.empty().withSessionId("dup")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("dup");
    }

    @Test
    @DisplayName("A malformed seed is reported and the operator is asked for details")
    void malformedSeed() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());

        RunResult result = engine.start(SessionSeed.fromJson("{not json"));

        assertThat(result).isInstanceOf(RunResult.Waiting.class);
        RunResult.Waiting waiting = (RunResult.Waiting) result;
        assertThat(waiting.state().errors()).extracting(WorkflowError::kind).containsExactly(ErrorKind.INVALID_INPUT);
        assertThat(waiting.prompt().requests()).extracting(r -> r.requestId())
                .containsExactly("missing:initialize:incident-details#0");
    }

    @Test
    @DisplayName("Concurrent sessions run independently")
    void concurrentSessions() {
        IncidentWorkflowEngine engine = engine(EngineSettings.defaults(), ReasoningAdapters.ruleBased());
        List<String> alertIds = List.of("cpu_1", "disk_2", "network_3", "memory_4", "cpu_5", "disk_6");

        List<CompletableFuture<RunResult>> futures = alertIds.stream()
                .map(id -> engine.startAsync(SessionSeed.ofAlert(AlertInfo.of(id, "medium")).withSessionId("s-" + id)))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        for (int i = 0; i < alertIds.size(); i++) {
            RunResult result = futures.get(i).join();
            assertThat(result.sessionId()).isEqualTo("s-" + alertIds.get(i));
            if (result instanceof RunResult.Completed completed) {
                assertThat(completed.state().alertInfo().id()).isEqualTo(alertIds.get(i));
                assertThat(completed.status()).isEqualTo(SessionStatus.COMPLETED);
            } else {
                // memory plans wait for approval
                assertThat(result).isInstanceOf(RunResult.Waiting.class);
                assertThat(((RunResult.Waiting) result).state().alertInfo().id()).isEqualTo("memory_4");
            }
        }
        assertThat(engine.activeSessionIds()).containsExactly("s-memory_4");

        RunResult.Waiting waiting = (RunResult.Waiting) futures.get(3).join();
        RunResult resumed = engine.resumeAsync(waiting.token(), "approve").join();
        assertThat(resumed).isInstanceOf(RunResult.Completed.class);
        assertThat(((RunResult.Completed) resumed).status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(engine.activeSessionIds()).isEmpty();
    }

    private IncidentWorkflowEngine engine(EngineSettings settings, ReasoningAdapters adapters) {
        return engine(settings, adapters, Clock.systemUTC());
    }

    private IncidentWorkflowEngine engine(EngineSettings settings, ReasoningAdapters adapters, Clock clock) {
        IncidentWorkflowEngine engine = IncidentWorkflowEngine.builder()
                .settings(settings)
                .adapters(adapters)
                .clock(clock)
                .build();
        engines.add(engine);
        return engine;
    }

    private static IncidentState completed(RunResult result, SessionStatus expected) {
        assertThat(result).isInstanceOf(RunResult.Completed.class);
        RunResult.Completed completed = (RunResult.Completed) result;
        assertThat(completed.status()).isEqualTo(expected);
        assertThat(completed.state().status()).isEqualTo(expected);
        return completed.state();
    }

    private static List<String> stages(RunResult result) {
        return result.visitedStages().stream().map(StageVisit::stage).toList();
    }

    private static final class CountingBackend implements ExecutionBackend {
        private final AtomicInteger calls = new AtomicInteger();
        private final SimulatedExecutionBackend delegate = new SimulatedExecutionBackend();

        @Override
        public ExecutionOutcome execute(ActionPlan plan) {
            calls.incrementAndGet();
            return delegate.execute(plan);
        }
    }
}
