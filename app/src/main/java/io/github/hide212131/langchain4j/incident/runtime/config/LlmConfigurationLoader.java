package io.github.hide212131.langchain4j.incident.runtime.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the LLM settings. Environment variables win; the {@code .env} file is read only for
 * keys the environment does not define.
 */
public final class LlmConfigurationLoader {

    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_OPENAI_BASE_URL = "OPENAI_BASE_URL";
    static final String ENV_OPENAI_MODEL = "OPENAI_MODEL";
    static final String ENV_OPENAI_TIMEOUT_SECONDS = "OPENAI_TIMEOUT_SECONDS";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public LlmConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    LlmConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public LlmConfiguration load() {
        return load(null);
    }

    public LlmConfiguration load(LlmProvider overrideProvider) {
        LlmProvider provider = overrideProvider != null ? overrideProvider : LlmProvider.from(resolve(ENV_LLM_PROVIDER));
        String apiKey = trimToNull(resolve(ENV_OPENAI_API_KEY));
        if (provider == LlmProvider.OPENAI && apiKey == null) {
            throw new IllegalStateException("OPENAI_API_KEY is required when LLM_PROVIDER=openai");
        }
        return new LlmConfiguration(
                provider,
                apiKey,
                trimToNull(resolve(ENV_OPENAI_BASE_URL)),
                trimToNull(resolve(ENV_OPENAI_MODEL)),
                resolveTimeout());
    }

    private Duration resolveTimeout() {
        String raw = trimToNull(resolve(ENV_OPENAI_TIMEOUT_SECONDS));
        if (raw == null) {
            return LlmConfiguration.DEFAULT_TIMEOUT;
        }
        long seconds;
        try {
            seconds = Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(ENV_OPENAI_TIMEOUT_SECONDS + " must be a positive integer (seconds)", ex);
        }
        if (seconds <= 0) {
            throw new IllegalStateException(ENV_OPENAI_TIMEOUT_SECONDS + " must be greater than zero");
        }
        return Duration.ofSeconds(seconds);
    }

    private String resolve(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
