package io.github.hide212131.langchain4j.incident.runtime.suspension;

import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import java.util.List;
import java.util.Map;

/**
 * Structured form of an operator answer. Every field is optional.
 */
public record OperatorInput(
        String answer,
        String approval,
        AlertInfo alertInfo,
        List<String> symptoms,
        Map<String, Object> context) {
}
