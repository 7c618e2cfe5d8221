package io.github.hide212131.langchain4j.incident.runtime.routing;

import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.RoutingDecision;

/**
 * Chooses the next step from the current state. Implementations must be pure: the same state
 * always yields the same decision.
 */
@FunctionalInterface
public interface Router {

    RoutingDecision decide(IncidentState state);
}
