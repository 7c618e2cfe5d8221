package io.github.hide212131.langchain4j.incident.runtime.adapter.llm;

import io.github.hide212131.langchain4j.incident.runtime.adapter.ActionPlanner;
import io.github.hide212131.langchain4j.incident.runtime.adapter.AdapterException;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionPlan;
import io.github.hide212131.langchain4j.incident.runtime.model.ActionStep;
import io.github.hide212131.langchain4j.incident.runtime.model.Diagnosis;
import io.github.hide212131.langchain4j.incident.runtime.provider.LlmReasoningClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class LlmActionPlanner extends LlmJsonAdapter implements ActionPlanner {

    public LlmActionPlanner(LlmReasoningClient client, ObjectMapper objectMapper) {
        super(client, objectMapper);
    }

    @Override
    String instruction() {
        return """
                You are an SRE writing a remediation plan for a diagnosed incident.
                Fields: steps (array of objects with actionType, description, command, riskLevel, rollbackCommand),
                riskLevel (low, medium, high or critical), rollbackPlan (array of step objects), etaMinutes (integer),
                approvalRequired (boolean).""";
    }

    @Override
    public ActionPlan plan(Diagnosis diagnosis, Map<String, Object> context) throws AdapterException {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("diagnosis", diagnosis);
        input.put("context", context);
        JsonNode reply = ask("Diagnosis and context:\n" + json(input));
        List<ActionStep> steps = steps(reply.get("steps"), "");
        if (steps.isEmpty()) {
            throw new AdapterException("model reply has no plan steps");
        }
        JsonNode eta = reply.get("etaMinutes");
        JsonNode approval = reply.get("approvalRequired");
        return new ActionPlan(
                "plan-" + diagnosis.diagnosisId(),
                steps,
                text(reply, "riskLevel", "medium"),
                steps(reply.get("rollbackPlan"), "r"),
                eta != null && eta.canConvertToInt() ? Math.max(0, eta.asInt()) : 0,
                approval != null && approval.asBoolean(false));
    }

    private static List<ActionStep> steps(JsonNode array, String idPrefix) {
        List<ActionStep> steps = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return steps;
        }
        int index = 1;
        for (JsonNode step : array) {
            steps.add(new ActionStep(
                    idPrefix + index++,
                    text(step, "actionType", ""),
                    text(step, "description", ""),
                    text(step, "command", ""),
                    text(step, "riskLevel", "low"),
                    text(step, "rollbackCommand", null)));
        }
        return steps;
    }
}
