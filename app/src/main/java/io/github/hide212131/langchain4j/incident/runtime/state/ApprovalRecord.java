package io.github.hide212131.langchain4j.incident.runtime.state;

import java.time.Instant;
import java.util.Objects;

public record ApprovalRecord(String planId, ApprovalDecision decision, Instant decidedAt) {

    public ApprovalRecord {
        Objects.requireNonNull(planId, "planId");
        Objects.requireNonNull(decision, "decision");
        decidedAt = decidedAt == null ? Instant.now() : decidedAt;
    }

    public boolean appliesTo(String candidatePlanId) {
        return planId.equals(candidatePlanId);
    }
}
