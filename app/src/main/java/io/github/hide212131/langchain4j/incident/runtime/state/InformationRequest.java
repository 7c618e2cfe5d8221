package io.github.hide212131.langchain4j.incident.runtime.state;

import java.util.List;
import java.util.Objects;

/**
 * Describes one piece of information a session waits for. {@code requestId} is unique within a
 * session; {@code subjectId} names what the request is about (a diagnosis id, a plan id) so the
 * router can tell whether that subject was already asked about.
 */
public record InformationRequest(
        String requestId,
        RequestKind kind,
        StepName requestedBy,
        String question,
        List<String> expectedFields,
        String subjectId) {

    public InformationRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must be provided");
        }
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(requestedBy, "requestedBy");
        question = question == null ? "" : question;
        expectedFields = expectedFields == null ? List.of() : List.copyOf(expectedFields);
    }

    public static InformationRequest missing(StepName step, String field, int attempt) {
        return new InformationRequest(
                "missing:" + step.wireName() + ":" + field + "#" + attempt,
                RequestKind.MISSING_INPUT,
                step,
                "Step " + step.wireName() + " needs '" + field + "' to continue. Please describe the incident.",
                List.of(field),
                null);
    }
}
