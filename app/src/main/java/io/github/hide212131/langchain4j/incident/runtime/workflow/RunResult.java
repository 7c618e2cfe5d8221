package io.github.hide212131.langchain4j.incident.runtime.workflow;

import io.github.hide212131.langchain4j.incident.runtime.state.CollectionPrompt;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.SessionStatus;
import io.github.hide212131.langchain4j.incident.runtime.suspension.ResumptionToken;
import java.util.List;
import java.util.Objects;

/**
 * What a caller gets back from starting or resuming a session.
 */
public sealed interface RunResult permits RunResult.Completed, RunResult.Waiting, RunResult.Cancelled {

    String sessionId();

    List<StageVisit> visitedStages();

    /** The session reached a terminal status; {@code state} is final. */
    record Completed(IncidentState state, SessionStatus status, List<StageVisit> visitedStages) implements RunResult {
        public Completed {
            Objects.requireNonNull(state, "state");
            Objects.requireNonNull(status, "status");
            if (!status.isTerminal()) {
                throw new IllegalArgumentException("not a terminal status: " + status);
            }
            visitedStages = List.copyOf(visitedStages);
        }

        @Override
        public String sessionId() {
            return state.sessionId();
        }
    }

    /** The session is suspended until {@code token} is resumed with the operator's answer. */
    record Waiting(
            String sessionId,
            CollectionPrompt prompt,
            ResumptionToken token,
            IncidentState state,
            List<StageVisit> visitedStages) implements RunResult {
        public Waiting {
            Objects.requireNonNull(sessionId, "sessionId");
            Objects.requireNonNull(prompt, "prompt");
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(state, "state");
            visitedStages = List.copyOf(visitedStages);
        }
    }

    /** The session was cancelled while this drive was running; its state was discarded. */
    record Cancelled(String sessionId, List<StageVisit> visitedStages) implements RunResult {
        public Cancelled {
            Objects.requireNonNull(sessionId, "sessionId");
            visitedStages = List.copyOf(visitedStages);
        }
    }
}
