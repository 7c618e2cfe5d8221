package io.github.hide212131.langchain4j.incident.runtime.state;

import java.util.List;
import java.util.Objects;

/**
 * What a suspended session shows to the operator: a message and the requests it waits for.
 */
public record CollectionPrompt(String message, List<InformationRequest> requests) {

    public CollectionPrompt {
        Objects.requireNonNull(message, "message");
        requests = requests == null ? List.of() : List.copyOf(requests);
        if (requests.isEmpty()) {
            throw new IllegalArgumentException("a prompt needs at least one request");
        }
    }

    public boolean asksFor(RequestKind kind) {
        return requests.stream().anyMatch(request -> request.kind() == kind);
    }
}
