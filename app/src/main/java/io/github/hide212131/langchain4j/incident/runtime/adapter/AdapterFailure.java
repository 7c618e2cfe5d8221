package io.github.hide212131.langchain4j.incident.runtime.adapter;

import java.util.Objects;

/**
 * Typed failure raised by {@link AdapterInvoker} so that steps can record it without inspecting
 * arbitrary exception types.
 */
public final class AdapterFailure extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String adapter;
    private final FailureKind kind;

    public AdapterFailure(String adapter, FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String adapter() {
        return adapter;
    }

    public FailureKind kind() {
        return kind;
    }

    public String describe() {
        return adapter + " " + kind.name().toLowerCase() + ": " + getMessage();
    }
}
