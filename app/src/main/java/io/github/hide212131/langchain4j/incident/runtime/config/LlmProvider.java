package io.github.hide212131.langchain4j.incident.runtime.config;

import java.util.Locale;

/**
 * Backend used by the reasoning adapters.
 */
public enum LlmProvider {
    MOCK,
    OPENAI;

    public static LlmProvider from(String value) {
        if (value == null || value.isBlank()) {
            return MOCK;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "openai" -> OPENAI;
            case "mock" -> MOCK;
            default -> throw new IllegalArgumentException("Invalid LLM_PROVIDER value: " + value);
        };
    }
}
