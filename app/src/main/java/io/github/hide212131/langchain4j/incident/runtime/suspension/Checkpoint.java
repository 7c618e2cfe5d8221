package io.github.hide212131.langchain4j.incident.runtime.suspension;

import io.github.hide212131.langchain4j.incident.runtime.state.CollectionPrompt;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Everything needed to continue a suspended session.
 */
public record Checkpoint(
        String sessionId,
        ResumptionToken token,
        IncidentState state,
        CollectionPrompt prompt,
        Instant suspendedAt) {

    public Checkpoint {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(suspendedAt, "suspendedAt");
        if (!sessionId.equals(state.sessionId())) {
            throw new IllegalArgumentException("checkpoint session " + sessionId + " does not match state "
                    + state.sessionId());
        }
    }

    public boolean expiredAt(Instant now, Duration ttl) {
        return !suspendedAt.plus(ttl).isAfter(now);
    }
}
