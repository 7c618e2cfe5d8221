package io.github.hide212131.langchain4j.incident.runtime.workflow;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.infra.observability.ObservabilityConfig;
import io.github.hide212131.langchain4j.incident.infra.observability.WorkflowTracer;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterInvoker;
import io.github.hide212131.langchain4j.incident.runtime.adapter.ReasoningAdapters;
import io.github.hide212131.langchain4j.incident.runtime.config.EngineSettings;
import io.github.hide212131.langchain4j.incident.runtime.routing.Router;
import io.github.hide212131.langchain4j.incident.runtime.routing.RoutingPolicy;
import io.github.hide212131.langchain4j.incident.runtime.state.ErrorKind;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.InformationRequest;
import io.github.hide212131.langchain4j.incident.runtime.state.RoutingDecision;
import io.github.hide212131.langchain4j.incident.runtime.state.SessionStatus;
import io.github.hide212131.langchain4j.incident.runtime.state.StateJson;
import io.github.hide212131.langchain4j.incident.runtime.state.StateMerger;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import io.github.hide212131.langchain4j.incident.runtime.state.WorkflowError;
import io.github.hide212131.langchain4j.incident.runtime.step.StepOutcome;
import io.github.hide212131.langchain4j.incident.runtime.step.WorkflowStep;
import io.github.hide212131.langchain4j.incident.runtime.suspension.Checkpoint;
import io.github.hide212131.langchain4j.incident.runtime.suspension.CheckpointStore;
import io.github.hide212131.langchain4j.incident.runtime.suspension.InMemoryCheckpointStore;
import io.github.hide212131.langchain4j.incident.runtime.suspension.InputNormalizer;
import io.github.hide212131.langchain4j.incident.runtime.suspension.ResumptionToken;
import io.github.hide212131.langchain4j.incident.runtime.suspension.SuspensionController;
import io.github.hide212131.langchain4j.incident.runtime.suspension.UnknownTokenException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives incident sessions through the router/step loop.
 *
 * <p>Each session has exactly one driver at a time: {@link #start} creates it, and a suspended
 * session can only be continued by the single caller that consumes its resumption token. The
 * state record is replaced, never mutated, so a waiting or completed result never exposes a
 * half-applied step. Sessions share nothing except the bounded adapter pool.</p>
 */
public final class IncidentWorkflowEngine implements AutoCloseable {

    private final EngineSettings settings;
    private final Router router;
    private final Map<StepName, WorkflowStep> steps;
    private final SuspensionController suspension;
    private final InputNormalizer normalizer;
    private final AdapterInvoker invoker;
    private final WorkflowLogger logger;
    private final WorkflowTracer tracer;
    private final Clock clock;
    private final ExecutorService driverExecutor;
    private final Map<String, SessionHandle> sessions = new ConcurrentHashMap<>();

    private IncidentWorkflowEngine(Builder builder) {
        this.settings = builder.settings;
        this.logger = builder.logger;
        this.tracer = builder.tracer;
        this.clock = builder.clock;
        this.router = builder.router != null
                ? builder.router
                : new RoutingPolicy(settings.confidenceThreshold(), settings.maxStepAttempts());
        this.invoker = new AdapterInvoker(settings.adapterTimeout(), settings.adapterConcurrency(), logger);
        this.normalizer = new InputNormalizer(builder.adapters.textExtractor(), invoker, StateJson.objectMapper(),
                logger, clock);
        this.suspension = new SuspensionController(builder.checkpointStore, normalizer, logger, clock);
        Map<StepName, WorkflowStep> wired = WorkflowSteps.standard(builder.adapters, settings, invoker, logger, clock);
        wired.putAll(builder.stepOverrides);
        this.steps = Collections.unmodifiableMap(wired);
        this.driverExecutor = Executors.newFixedThreadPool(settings.adapterConcurrency(), new DriverThreadFactory());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Engine with default settings, in-memory checkpoints and tracing configured from the
     * environment.
     */
    public static IncidentWorkflowEngine withDefaults(ReasoningAdapters adapters) {
        return builder()
                .adapters(adapters)
                .tracingFromEnvironment()
                .build();
    }

    public RunResult start(SessionSeed seed) {
        Objects.requireNonNull(seed, "seed");
        String sessionId = seed.sessionId() != null ? seed.sessionId() : UUID.randomUUID().toString();
        SessionHandle handle = new SessionHandle(sessionId);
        if (sessions.putIfAbsent(sessionId, handle) != null) {
            throw new IllegalStateException("Session " + sessionId + " is already active");
        }
        logger.info("[{}] session started", sessionId);
        try {
            IncidentState state = initialize(sessionId, seed);
            return drive(state, handle);
        } catch (RuntimeException e) {
            sessions.remove(sessionId, handle);
            throw e;
        }
    }

    /**
     * Continues a suspended session with the operator's answer (text or a map of fields).
     *
     * @throws UnknownTokenException if the token was already used, expired, or its session was cancelled
     */
    public RunResult resume(ResumptionToken token, Object input) {
        Checkpoint checkpoint = suspension.take(token);
        SessionHandle handle = sessions.get(checkpoint.sessionId());
        if (handle == null || handle.cancelled.get()) {
            throw new UnknownTokenException(token);
        }
        if (checkpoint.expiredAt(clock.instant(), settings.checkpointTtl())) {
            sessions.remove(checkpoint.sessionId(), handle);
            logger.warn("[{}] resume after checkpoint expiry rejected", checkpoint.sessionId());
            throw new UnknownTokenException(token);
        }
        IncidentState state = suspension.resume(checkpoint, input);
        return drive(state, handle);
    }

    public CompletableFuture<RunResult> startAsync(SessionSeed seed) {
        return CompletableFuture.supplyAsync(() -> start(seed), driverExecutor);
    }

    public CompletableFuture<RunResult> resumeAsync(ResumptionToken token, Object input) {
        return CompletableFuture.supplyAsync(() -> resume(token, input), driverExecutor);
    }

    /**
     * Discards a session. A running drive stops at its next cycle boundary; side effects of
     * actions already executed are not rolled back.
     *
     * @return false if the session was not active
     */
    public boolean cancel(String sessionId) {
        SessionHandle handle = sessions.remove(sessionId);
        if (handle == null) {
            return false;
        }
        handle.cancelled.set(true);
        suspension.discardSession(sessionId);
        logger.info("[{}] session cancelled", sessionId);
        return true;
    }

    /** Discards sessions whose checkpoint waited longer than the configured TTL. */
    public List<String> expireIdleCheckpoints() {
        List<String> expired = new ArrayList<>();
        for (Checkpoint checkpoint : suspension.expire(settings.checkpointTtl())) {
            SessionHandle handle = sessions.remove(checkpoint.sessionId());
            if (handle != null) {
                handle.cancelled.set(true);
            }
            expired.add(checkpoint.sessionId());
        }
        return expired;
    }

    public Set<String> activeSessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    public Optional<Checkpoint> pendingCheckpoint(String sessionId) {
        return suspension.peek(sessionId);
    }

    public EngineSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        driverExecutor.shutdownNow();
        invoker.close();
    }

    private IncidentState initialize(String sessionId, SessionSeed seed) {
        SeedFields fields = seed.fields();
        StateUpdate update = StateUpdate.by(StepName.INITIALIZE);
        if (fields.alertInfo() != null) {
            update.alertInfo(fields.alertInfo());
        }
        update.addSymptoms(fields.symptoms());
        update.putContext(fields.context());
        if (fields.analysisResult() != null) {
            update.analysis(fields.analysisResult());
        }
        if (fields.diagnosticResult() != null) {
            update.diagnosis(fields.diagnosticResult());
        }
        if (fields.actionPlan() != null) {
            update.plan(fields.actionPlan());
        }
        for (String problem : seed.problems()) {
            logger.warn("[{}] {}", sessionId, problem);
            update.error(WorkflowError.of(ErrorKind.INVALID_INPUT, StepName.INITIALIZE, problem));
        }
        if (!seed.problems().isEmpty()) {
            update.request(InformationRequest.missing(StepName.INITIALIZE, "incident-details", 0));
        }
        IncidentState state = StateMerger.merge(IncidentState.initial(sessionId), update);
        if (seed.text() != null) {
            state = StateMerger.merge(state, normalizer.normalizeSeedText(state, seed.text()));
        }
        return state;
    }

    private RunResult drive(IncidentState initial, SessionHandle handle) {
        return tracer.trace("incident.session", Map.of(
                "incident.session.id", handle.sessionId,
                "incident.session.cycles", initial.cycles(),
                "incident.session.collection_attempts", initial.collectionAttempts()),
                () -> loop(initial, handle));
    }

    private RunResult loop(IncidentState initial, SessionHandle handle) {
        Instant deadline = clock.instant().plus(settings.maxRunDuration());
        IncidentState state = initial;
        while (true) {
            if (handle.cancelled.get()) {
                return cancelled(handle);
            }
            if (clock.instant().isAfter(deadline)) {
                return finish(handle, state.terminate(SessionStatus.SESSION_TIMEOUT, WorkflowError.engine(
                        ErrorKind.SESSION_TIMEOUT, "run exceeded " + settings.maxRunDuration())));
            }

            RoutingDecision decision = router.decide(state);
            state = state.toBuilder().routingTrace(decision).build();
            logger.info("[{}] cycle {} -> {} ({}; confidence {})", state.sessionId(), state.cycles() + 1,
                    decision.nextStep(), decision.rationale(), decision.confidence());

            if (decision.isTerminal()) {
                return finish(handle, completeOrFail(state, decision));
            }
            if (state.cycles() >= settings.maxCycles()) {
                logger.error("[{}] cycle limit {} reached", state.sessionId(), settings.maxCycles());
                return finish(handle, state.terminate(SessionStatus.CYCLE_LIMIT_EXCEEDED, WorkflowError.engine(
                        ErrorKind.CYCLE_LIMIT_EXCEEDED, "cycle limit of " + settings.maxCycles() + " reached")));
            }

            IncidentState.Builder next = state.toBuilder().cycles(state.cycles() + 1);
            decision.proposedRequests().forEach(next::addRequest);
            state = next.build();
            handle.visits.add(new StageVisit(state.cycles(), decision.nextStep().wireName()));

            StepOutcome outcome = runStep(state, decision.nextStep());
            state = apply(state, decision.nextStep(), outcome.update());

            if (outcome instanceof StepOutcome.Suspend suspend) {
                if (handle.cancelled.get()) {
                    return cancelled(handle);
                }
                if (state.collectionAttempts() >= settings.collectionCap()) {
                    logger.warn("[{}] collection cap {} reached", state.sessionId(), settings.collectionCap());
                    return finish(handle, state.terminate(SessionStatus.COLLECTION_EXHAUSTED, WorkflowError.engine(
                            ErrorKind.SUSPENSION_EXHAUSTED, "no usable input after " + settings.collectionCap()
                                    + " request(s) for information")));
                }
                state = state.toBuilder().collectionAttempts(state.collectionAttempts() + 1).build();
                Checkpoint checkpoint = suspension.suspend(state, suspend.prompt());
                // cancel() may have run between the check above and the save
                if (handle.cancelled.get()) {
                    suspension.discardSession(state.sessionId());
                    return cancelled(handle);
                }
                tracer.addEvent("incident.suspended", Map.of(
                        "incident.session.id", state.sessionId(),
                        "incident.collection_attempt", String.valueOf(state.collectionAttempts())));
                return new RunResult.Waiting(state.sessionId(), suspend.prompt(), checkpoint.token(),
                        checkpoint.state(), snapshot(handle));
            }
        }
    }

    private StepOutcome runStep(IncidentState state, StepName name) {
        WorkflowStep step = steps.get(name);
        if (step == null) {
            throw new IllegalStateException("No step registered for " + name);
        }
        try {
            return tracer.trace("incident.step." + name.wireName(), Map.of(
                    "incident.session.id", state.sessionId(),
                    "incident.cycle", state.cycles()),
                    () -> {
                        logger.debug("[{}] {} started", state.sessionId(), name);
                        StepOutcome outcome = step.run(state);
                        logger.debug("[{}] {} finished", state.sessionId(), name);
                        return outcome;
                    });
        } catch (RuntimeException e) {
            logger.error("[{}] {} threw {}: {}", state.sessionId(), name, e.getClass().getSimpleName(),
                    e.getMessage());
            return StepOutcome.proceed(stepFailure(name, e));
        }
    }

    private IncidentState apply(IncidentState state, StepName name, StateUpdate update) {
        try {
            return StateMerger.merge(state, update);
        } catch (IllegalStateException e) {
            logger.error("[{}] update from {} rejected: {}", state.sessionId(), name, e.getMessage());
            return StateMerger.merge(state, stepFailure(name, e));
        }
    }

    private static StateUpdate stepFailure(StepName name, RuntimeException e) {
        return StateUpdate.by(name)
                .error(WorkflowError.of(ErrorKind.STEP_FAILURE, name, e.getClass().getSimpleName() + ": "
                        + e.getMessage()))
                .failed();
    }

    private static IncidentState completeOrFail(IncidentState state, RoutingDecision decision) {
        if (state.report() != null) {
            return state.terminate(SessionStatus.COMPLETED, null);
        }
        return state.terminate(SessionStatus.FAILED, WorkflowError.engine(ErrorKind.STEP_FAILURE,
                "session ended without a report: " + decision.rationale()));
    }

    private RunResult finish(SessionHandle handle, IncidentState state) {
        sessions.remove(handle.sessionId, handle);
        logger.info("[{}] session finished with status {} after {} cycle(s) and {} error(s)", state.sessionId(),
                state.status(), state.cycles(), state.errors().size());
        return new RunResult.Completed(state, state.status(), snapshot(handle));
    }

    private RunResult cancelled(SessionHandle handle) {
        logger.info("[{}] drive stopped: session cancelled", handle.sessionId);
        return new RunResult.Cancelled(handle.sessionId, snapshot(handle));
    }

    private static List<StageVisit> snapshot(SessionHandle handle) {
        synchronized (handle.visits) {
            return List.copyOf(handle.visits);
        }
    }

    private static final class SessionHandle {
        private final String sessionId;
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final List<StageVisit> visits = Collections.synchronizedList(new ArrayList<>());

        private SessionHandle(String sessionId) {
            this.sessionId = sessionId;
        }
    }

    private static final class DriverThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "incident-session-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static final class Builder {
        private EngineSettings settings = EngineSettings.defaults();
        private ReasoningAdapters adapters = ReasoningAdapters.ruleBased();
        private Router router;
        private CheckpointStore checkpointStore = new InMemoryCheckpointStore();
        private WorkflowLogger logger = new WorkflowLogger(IncidentWorkflowEngine.class);
        private WorkflowTracer tracer = WorkflowTracer.disabled();
        private Clock clock = Clock.systemUTC();
        private final Map<StepName, WorkflowStep> stepOverrides = new EnumMap<>(StepName.class);

        private Builder() {
        }

        public Builder settings(EngineSettings value) {
            this.settings = Objects.requireNonNull(value, "settings");
            return this;
        }

        public Builder adapters(ReasoningAdapters value) {
            this.adapters = Objects.requireNonNull(value, "adapters");
            return this;
        }

        /** Replaces the default {@link RoutingPolicy}. */
        public Builder router(Router value) {
            this.router = Objects.requireNonNull(value, "router");
            return this;
        }

        public Builder checkpointStore(CheckpointStore value) {
            this.checkpointStore = Objects.requireNonNull(value, "checkpointStore");
            return this;
        }

        public Builder logger(WorkflowLogger value) {
            this.logger = Objects.requireNonNull(value, "logger");
            return this;
        }

        public Builder tracer(WorkflowTracer value) {
            this.tracer = Objects.requireNonNull(value, "tracer");
            return this;
        }

        /** Exports spans over OTLP when {@code INCIDENT_OTLP_*} variables are configured. */
        public Builder tracingFromEnvironment() {
            this.tracer = ObservabilityConfig.fromEnvironment().workflowTracer();
            return this;
        }

        public Builder clock(Clock value) {
            this.clock = Objects.requireNonNull(value, "clock");
            return this;
        }

        /** Replaces the standard step registered under the step's name. */
        public Builder step(WorkflowStep value) {
            Objects.requireNonNull(value, "step");
            if (value.name() == StepName.TERMINAL || value.name() == StepName.INITIALIZE) {
                throw new IllegalArgumentException(value.name() + " cannot be replaced");
            }
            stepOverrides.put(value.name(), value);
            return this;
        }

        public IncidentWorkflowEngine build() {
            return new IncidentWorkflowEngine(this);
        }
    }
}
