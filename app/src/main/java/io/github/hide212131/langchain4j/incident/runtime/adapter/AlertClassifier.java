package io.github.hide212131.langchain4j.incident.runtime.adapter;

import io.github.hide212131.langchain4j.incident.runtime.model.AlertAnalysis;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;

@FunctionalInterface
public interface AlertClassifier {

    AlertAnalysis classify(AlertInfo alert) throws AdapterException;
}
