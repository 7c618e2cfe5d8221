package io.github.hide212131.langchain4j.incident.runtime.routing;

import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.InformationRequest;
import io.github.hide212131.langchain4j.incident.runtime.state.RequestKind;
import io.github.hide212131.langchain4j.incident.runtime.state.RoutingDecision;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Priority-ordered routing rules. The first matching rule wins:
 *
 * <ol>
 *   <li>pending collection requests: {@code collect_info}</li>
 *   <li>alert without analysis: {@code process_alert}</li>
 *   <li>symptoms without diagnosis: {@code diagnose_issue}</li>
 *   <li>low-confidence diagnosis not yet asked about: {@code collect_info} with a clarification request</li>
 *   <li>low-confidence diagnosis already clarified and no plan: {@code diagnose_issue} again</li>
 *   <li>confident diagnosis without plan: {@code plan_actions}</li>
 *   <li>plan without execution result: {@code execute_actions}</li>
 *   <li>execution result without report: {@code generate_report}</li>
 *   <li>report present: terminal</li>
 *   <li>anything else: {@code collect_info} with a request for incident details</li>
 * </ol>
 *
 * <p>A step that already failed {@code maxStepAttempts} times is not routed to again; the session
 * falls through to {@code generate_report} so that it ends with a degraded report instead of
 * stalling. If report generation itself is exhausted the session stops.</p>
 */
public final class RoutingPolicy implements Router {

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.6;
    public static final int DEFAULT_MAX_STEP_ATTEMPTS = 3;

    private final double confidenceThreshold;
    private final int maxStepAttempts;

    public RoutingPolicy(double confidenceThreshold, int maxStepAttempts) {
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0,1]: " + confidenceThreshold);
        }
        if (maxStepAttempts < 1) {
            throw new IllegalArgumentException("maxStepAttempts must be positive");
        }
        this.confidenceThreshold = confidenceThreshold;
        this.maxStepAttempts = maxStepAttempts;
    }

    public static RoutingPolicy withDefaults() {
        return new RoutingPolicy(DEFAULT_CONFIDENCE_THRESHOLD, DEFAULT_MAX_STEP_ATTEMPTS);
    }

    public double confidenceThreshold() {
        return confidenceThreshold;
    }

    @Override
    public RoutingDecision decide(IncidentState state) {
        Objects.requireNonNull(state, "state");
        RoutingDecision decision = applyRules(state);
        return degradeIfExhausted(state, decision);
    }

    private RoutingDecision applyRules(IncidentState state) {
        if (state.hasPendingCollection()) {
            return RoutingDecision.to(StepName.COLLECT_INFO,
                    state.pendingCollection().size() + " information request(s) pending", 1.0);
        }
        if (state.hasAlert() && state.analysisResult() == null) {
            return RoutingDecision.to(StepName.PROCESS_ALERT,
                    "alert " + state.alertInfo().id() + " has not been analysed", 1.0);
        }
        if (state.hasSymptoms() && state.diagnosticResult() == null) {
            return RoutingDecision.to(StepName.DIAGNOSE_ISSUE,
                    state.symptoms().size() + " symptom(s) without diagnosis", 1.0);
        }
        Diagnosis diagnosis = state.diagnosticResult();
        if (diagnosis != null && !diagnosis.isConfident(confidenceThreshold)) {
            if (!state.alreadyRequested(diagnosis.diagnosisId())) {
                return new RoutingDecision(
                        StepName.COLLECT_INFO,
                        String.format(Locale.ROOT, "diagnosis confidence %.2f below %.2f", diagnosis.confidenceScore(),
                                confidenceThreshold),
                        diagnosis.confidenceScore(),
                        List.of(clarificationRequest(diagnosis)));
            }
            if (state.actionPlan() == null) {
                return RoutingDecision.to(StepName.DIAGNOSE_ISSUE,
                        "clarification received for diagnosis " + diagnosis.diagnosisId() + "; re-diagnosing",
                        diagnosis.confidenceScore());
            }
        }
        if (diagnosis != null && state.actionPlan() == null) {
            return RoutingDecision.to(StepName.PLAN_ACTIONS,
                    "diagnosis '" + diagnosis.rootCause() + "' has no action plan", diagnosis.confidenceScore());
        }
        if (state.actionPlan() != null && state.executionResult() == null) {
            return RoutingDecision.to(StepName.EXECUTE_ACTIONS,
                    "plan " + state.actionPlan().planId() + " not executed", 1.0);
        }
        if (state.executionResult() != null && state.report() == null) {
            return RoutingDecision.to(StepName.GENERATE_REPORT,
                    "execution " + state.executionResult().status() + " not reported", 1.0);
        }
        if (state.report() != null) {
            return RoutingDecision.to(StepName.TERMINAL, "report available", 1.0);
        }
        return new RoutingDecision(
                StepName.COLLECT_INFO,
                "no rule matched; asking for incident details",
                0.0,
                List.of(incidentDetailsRequest(state)));
    }

    private RoutingDecision degradeIfExhausted(IncidentState state, RoutingDecision decision) {
        StepName next = decision.nextStep();
        if (next == StepName.TERMINAL || next == StepName.COLLECT_INFO) {
            return decision;
        }
        if (state.failures(next) < maxStepAttempts) {
            return decision;
        }
        if (state.report() != null) {
            return RoutingDecision.to(StepName.TERMINAL,
                    "degraded report available; " + next + " failed " + state.failures(next) + " time(s)", 0.0);
        }
        if (next == StepName.GENERATE_REPORT || state.failures(StepName.GENERATE_REPORT) >= maxStepAttempts) {
            return RoutingDecision.to(StepName.TERMINAL,
                    "report generation failed " + state.failures(StepName.GENERATE_REPORT) + " time(s)", 0.0);
        }
        return RoutingDecision.to(StepName.GENERATE_REPORT,
                "degraded: " + next + " failed " + state.failures(next) + " time(s)", 0.0);
    }

    private static InformationRequest clarificationRequest(Diagnosis diagnosis) {
        return new InformationRequest(
                "clarify:" + diagnosis.diagnosisId(),
                RequestKind.CLARIFICATION,
                StepName.DIAGNOSE_ISSUE,
                "The likely cause is '" + diagnosis.rootCause() + "' but confidence is low. "
                        + "Can you share more symptoms, recent changes or affected hosts?",
                List.of("symptoms", "context"),
                diagnosis.diagnosisId());
    }

    private static InformationRequest incidentDetailsRequest(IncidentState state) {
        return new InformationRequest(
                "missing:incident-details#" + state.collectionAttempts(),
                RequestKind.MISSING_INPUT,
                StepName.COLLECT_INFO,
                "Please describe the incident: what is failing, where, and how severe is it?",
                List.of("alertInfo", "symptoms"),
                null);
    }
}
