package io.github.hide212131.langchain4j.incident.runtime.adapter;

import io.github.hide212131.langchain4j.incident.runtime.adapter.rules.KeywordAlertClassifier;
import io.github.hide212131.langchain4j.incident.runtime.adapter.rules.KeywordTextExtractor;
import io.github.hide212131.langchain4j.incident.runtime.adapter.rules.SimulatedExecutionBackend;
import io.github.hide212131.langchain4j.incident.runtime.adapter.rules.SymptomDiagnosticEngine;
import io.github.hide212131.langchain4j.incident.runtime.adapter.rules.TemplateActionPlanner;
import io.github.hide212131.langchain4j.incident.runtime.adapter.rules.TemplateReportGenerator;
import java.util.Objects;

/**
 * The set of collaborators a workflow engine delegates reasoning and execution to.
 */
public record ReasoningAdapters(
        AlertClassifier alertClassifier,
        DiagnosticEngine diagnosticEngine,
        ActionPlanner actionPlanner,
        ExecutionBackend executionBackend,
        ReportGenerator reportGenerator,
        TextExtractor textExtractor) {

    public ReasoningAdapters {
        Objects.requireNonNull(alertClassifier, "alertClassifier");
        Objects.requireNonNull(diagnosticEngine, "diagnosticEngine");
        Objects.requireNonNull(actionPlanner, "actionPlanner");
        Objects.requireNonNull(executionBackend, "executionBackend");
        Objects.requireNonNull(reportGenerator, "reportGenerator");
        Objects.requireNonNull(textExtractor, "textExtractor");
    }

    /** Deterministic keyword and template based adapters; no network access. */
    public static ReasoningAdapters ruleBased() {
        return new ReasoningAdapters(
                new KeywordAlertClassifier(),
                new SymptomDiagnosticEngine(),
                new TemplateActionPlanner(),
                new SimulatedExecutionBackend(),
                new TemplateReportGenerator(),
                new KeywordTextExtractor());
    }

    public ReasoningAdapters withAlertClassifier(AlertClassifier value) {
        return new ReasoningAdapters(value, diagnosticEngine, actionPlanner, executionBackend, reportGenerator,
                textExtractor);
    }

    public ReasoningAdapters withDiagnosticEngine(DiagnosticEngine value) {
        return new ReasoningAdapters(alertClassifier, value, actionPlanner, executionBackend, reportGenerator,
                textExtractor);
    }

    public ReasoningAdapters withActionPlanner(ActionPlanner value) {
        return new ReasoningAdapters(alertClassifier, diagnosticEngine, value, executionBackend, reportGenerator,
                textExtractor);
    }

    public ReasoningAdapters withExecutionBackend(ExecutionBackend value) {
        return new ReasoningAdapters(alertClassifier, diagnosticEngine, actionPlanner, value, reportGenerator,
                textExtractor);
    }

    public ReasoningAdapters withReportGenerator(ReportGenerator value) {
        return new ReasoningAdapters(alertClassifier, diagnosticEngine, actionPlanner, executionBackend, value,
                textExtractor);
    }

    public ReasoningAdapters withTextExtractor(TextExtractor value) {
        return new ReasoningAdapters(alertClassifier, diagnosticEngine, actionPlanner, executionBackend,
                reportGenerator, value);
    }
}
