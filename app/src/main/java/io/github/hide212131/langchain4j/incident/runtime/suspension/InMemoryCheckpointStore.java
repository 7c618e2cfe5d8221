package io.github.hide212131.langchain4j.incident.runtime.suspension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<ResumptionToken, Checkpoint> byToken = new ConcurrentHashMap<>();
    private final Map<String, ResumptionToken> tokenBySession = new ConcurrentHashMap<>();

    @Override
    public void save(Checkpoint checkpoint) {
        ResumptionToken previous = tokenBySession.put(checkpoint.sessionId(), checkpoint.token());
        if (previous != null) {
            byToken.remove(previous);
        }
        byToken.put(checkpoint.token(), checkpoint);
    }

    @Override
    public Optional<Checkpoint> remove(ResumptionToken token) {
        Checkpoint checkpoint = byToken.remove(token);
        if (checkpoint == null) {
            return Optional.empty();
        }
        tokenBySession.remove(checkpoint.sessionId(), token);
        return Optional.of(checkpoint);
    }

    @Override
    public Optional<Checkpoint> findBySession(String sessionId) {
        ResumptionToken token = tokenBySession.get(sessionId);
        return token == null ? Optional.empty() : Optional.ofNullable(byToken.get(token));
    }

    @Override
    public Optional<Checkpoint> removeBySession(String sessionId) {
        ResumptionToken token = tokenBySession.remove(sessionId);
        return token == null ? Optional.empty() : Optional.ofNullable(byToken.remove(token));
    }

    @Override
    public List<Checkpoint> all() {
        return List.copyOf(byToken.values());
    }
}
