package io.github.hide212131.langchain4j.incident.runtime.suspension;

import java.util.List;
import java.util.Optional;

/**
 * Storage for suspended sessions, at most one checkpoint per session. Implementations must be
 * safe for concurrent use; {@link #remove} must hand a checkpoint to one caller only.
 */
public interface CheckpointStore {

    void save(Checkpoint checkpoint);

    Optional<Checkpoint> remove(ResumptionToken token);

    Optional<Checkpoint> findBySession(String sessionId);

    Optional<Checkpoint> removeBySession(String sessionId);

    List<Checkpoint> all();
}
