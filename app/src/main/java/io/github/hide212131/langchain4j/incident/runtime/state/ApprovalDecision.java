package io.github.hide212131.langchain4j.incident.runtime.state;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Operator answer to an approval request.
 */
public enum ApprovalDecision {
    APPROVED(Set.of("approved", "approve", "yes", "ok", "go")),
    REJECTED(Set.of("rejected", "reject", "deny", "no", "cancel")),
    MODIFICATION_REQUESTED(Set.of("modified", "modify", "change", "update"));

    private final Set<String> keywords;

    ApprovalDecision(Set<String> keywords) {
        this.keywords = keywords;
    }

    /**
     * Parses a free-text answer. Only the first word counts, so "yes, go ahead" approves while a
     * sentence that merely mentions "no" later on does not reject.
     */
    public static Optional<ApprovalDecision> parse(String answer) {
        if (answer == null) {
            return Optional.empty();
        }
        String trimmed = answer.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        String firstWord = trimmed.split("[^a-z]+", 2)[0];
        for (ApprovalDecision decision : values()) {
            if (decision.keywords.contains(firstWord)) {
                return Optional.of(decision);
            }
        }
        return Optional.empty();
    }
}
