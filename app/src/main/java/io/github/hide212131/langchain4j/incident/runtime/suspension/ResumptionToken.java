package io.github.hide212131.langchain4j.incident.runtime.suspension;

import java.util.UUID;

/**
 * Opaque handle returned to the caller of a suspended session.
 */
public record ResumptionToken(String value) {

    public ResumptionToken {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("token value must be provided");
        }
    }

    public static ResumptionToken random() {
        return new ResumptionToken(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
