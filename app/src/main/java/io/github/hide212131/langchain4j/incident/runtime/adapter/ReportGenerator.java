package io.github.hide212131.langchain4j.incident.runtime.adapter;

import io.github.hide212131.langchain4j.incident.runtime.model.ReportDraft;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;

@FunctionalInterface
public interface ReportGenerator {

    ReportDraft generate(IncidentState state) throws AdapterException;
}
