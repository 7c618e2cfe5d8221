package io.github.hide212131.langchain4j.incident.runtime.adapter;

import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.ExecutionOutcome;

/**
 * Carries out an approved plan. Implementations perform real side effects, which are not rolled
 * back if the session is cancelled afterwards.
 */
@FunctionalInterface
public interface ExecutionBackend {

    ExecutionOutcome execute(ActionPlan plan) throws AdapterException;
}
