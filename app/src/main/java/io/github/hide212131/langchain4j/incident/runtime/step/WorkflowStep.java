package io.github.hide212131.langchain4j.incident.runtime.step;

import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;

/**
 * One named stage of the workflow. A step reads the state it is given and describes its changes
 * in the returned outcome; it never routes to another step itself.
 */
public interface WorkflowStep {

    StepName name();

    StepOutcome run(IncidentState state);
}
