package io.github.hide212131.langchain4j.incident.runtime.state;

public enum SessionStatus {
    RUNNING(false),
    WAITING(false),
    COMPLETED(true),
    COLLECTION_EXHAUSTED(true),
    CYCLE_LIMIT_EXCEEDED(true),
    SESSION_TIMEOUT(true),
    FAILED(true),
    CANCELLED(true);

    private final boolean terminal;

    SessionStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
