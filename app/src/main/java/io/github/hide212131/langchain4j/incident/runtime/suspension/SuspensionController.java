package io.github.hide212131.langchain4j.incident.runtime.suspension;

import io.github.hide212131.langchain4j.incident.infra.logging.WorkflowLogger;
import io.github.hide212131.langchain4j.incident.runtime.state.CollectionPrompt;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.SessionStatus;
import io.github.hide212131.langchain4j.incident.runtime.state.StateMerger;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parks sessions that wait for operator input and hands them back on resume.
 *
 * <p>Suspending never blocks a thread: the checkpoint is stored and the caller returns. A token
 * can be resumed once; a second resume, or a resume after cancellation or expiry, fails with
 * {@link UnknownTokenException}.</p>
 */
public final class SuspensionController {

    private final CheckpointStore store;
    private final InputNormalizer normalizer;
    private final WorkflowLogger logger;
    private final Clock clock;

    public SuspensionController(CheckpointStore store, InputNormalizer normalizer, WorkflowLogger logger, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.logger = Objects.requireNonNull(logger, "logger").forComponent(SuspensionController.class);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stores a checkpoint for the session. The stored state is marked {@link SessionStatus#WAITING}.
     */
    public Checkpoint suspend(IncidentState state, CollectionPrompt prompt) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(prompt, "prompt");
        if (state.isTerminal()) {
            throw new IllegalStateException("Cannot suspend terminal session " + state.sessionId());
        }
        IncidentState waiting = state.toBuilder().status(SessionStatus.WAITING).build();
        Checkpoint checkpoint = new Checkpoint(state.sessionId(), ResumptionToken.random(), waiting, prompt,
                clock.instant());
        store.save(checkpoint);
        logger.info("[{}] suspended waiting for {} request(s), attempt {}", state.sessionId(),
                prompt.requests().size(), state.collectionAttempts());
        return checkpoint;
    }

    /**
     * Consumes the checkpoint for the token and applies the operator input to its state.
     *
     * @return the running state to continue routing from
     * @throws UnknownTokenException if no session waits on this token
     */
    public IncidentState resume(ResumptionToken token, Object rawInput) {
        return resume(take(token), rawInput);
    }

    /**
     * Applies operator input to a checkpoint already taken with {@link #take}.
     */
    public IncidentState resume(Checkpoint checkpoint, Object rawInput) {
        Objects.requireNonNull(checkpoint, "checkpoint");
        IncidentState running = checkpoint.state().toBuilder().status(SessionStatus.RUNNING).build();
        StateUpdate update = normalizer.normalize(running, checkpoint.prompt(), rawInput);
        logger.info("[{}] resumed with token {}", checkpoint.sessionId(), checkpoint.token());
        return StateMerger.merge(running, update);
    }

    public Checkpoint take(ResumptionToken token) {
        Objects.requireNonNull(token, "token");
        return store.remove(token).orElseThrow(() -> new UnknownTokenException(token));
    }

    public Optional<Checkpoint> peek(String sessionId) {
        return store.findBySession(sessionId);
    }

    public boolean discardSession(String sessionId) {
        Optional<Checkpoint> removed = store.removeBySession(sessionId);
        removed.ifPresent(checkpoint -> logger.info("[{}] checkpoint discarded", sessionId));
        return removed.isPresent();
    }

    /** Removes checkpoints older than {@code ttl} and returns them. */
    public List<Checkpoint> expire(Duration ttl) {
        Instant now = clock.instant();
        List<Checkpoint> expired = new ArrayList<>();
        for (Checkpoint checkpoint : store.all()) {
            if (checkpoint.expiredAt(now, ttl) && store.remove(checkpoint.token()).isPresent()) {
                logger.warn("[{}] checkpoint expired after {}", checkpoint.sessionId(), ttl);
                expired.add(checkpoint);
            }
        }
        return expired;
    }
}
