package io.github.hide212131.langchain4j.incident.runtime.state;

import java.time.Instant;
import java.util.Objects;

public record ConversationMessage(Role role, String text, Instant timestamp) {

    public ConversationMessage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(text, "text");
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ConversationMessage user(String text) {
        return new ConversationMessage(Role.USER, text, Instant.now());
    }

    public static ConversationMessage assistant(String text) {
        return new ConversationMessage(Role.ASSISTANT, text, Instant.now());
    }

    public static ConversationMessage system(String text) {
        return new ConversationMessage(Role.SYSTEM, text, Instant.now());
    }

    public enum Role {
        USER,
        ASSISTANT,
        SYSTEM
    }
}
