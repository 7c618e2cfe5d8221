package io.github.hide212131.langchain4j.incident.runtime.adapter;

import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import java.util.Map;

@FunctionalInterface
public interface ActionPlanner {

    ActionPlan plan(Diagnosis diagnosis, Map<String, Object> context) throws AdapterException;
}
