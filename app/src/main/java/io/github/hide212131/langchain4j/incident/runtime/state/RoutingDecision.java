package io.github.hide212131.langchain4j.incident.runtime.state;

import java.util.List;
import java.util.Objects;

/**
 * Router output. {@code proposedRequests} are merged into {@code pendingCollection} by the engine
 * before the chosen step runs; the router itself never mutates state.
 */
public record RoutingDecision(
        StepName nextStep,
        String rationale,
        double confidence,
        List<InformationRequest> proposedRequests) {

    public RoutingDecision {
        Objects.requireNonNull(nextStep, "nextStep");
        Objects.requireNonNull(rationale, "rationale");
        if (nextStep == StepName.INITIALIZE) {
            throw new IllegalArgumentException("initialize is not a routable step");
        }
        proposedRequests = proposedRequests == null ? List.of() : List.copyOf(proposedRequests);
    }

    public static RoutingDecision to(StepName nextStep, String rationale, double confidence) {
        return new RoutingDecision(nextStep, rationale, confidence, List.of());
    }

    public boolean isTerminal() {
        return nextStep == StepName.TERMINAL;
    }
}
