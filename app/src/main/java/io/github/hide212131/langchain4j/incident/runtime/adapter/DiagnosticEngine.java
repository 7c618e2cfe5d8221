package io.github.hide212131.langchain4j.incident.runtime.adapter;

import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;

@FunctionalInterface
public interface DiagnosticEngine {

    Diagnosis diagnose(DiagnosticRequest request) throws AdapterException;
}
