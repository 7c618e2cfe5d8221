package io.github.hide212131.langchain4j.incident.runtime.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

/**
 * Resolves {@link EngineSettings}. Priority, highest first: environment variables, the
 * {@code .env} file, the optional YAML file, built-in defaults.
 *
 * <p>The YAML file uses the record component names as keys, e.g. {@code maxCycles: 20} or
 * {@code adapterTimeoutSeconds: 5} for durations.</p>
 */
public final class EngineConfigurationLoader {

    static final String ENV_MAX_CYCLES = "INCIDENT_MAX_CYCLES";
    static final String ENV_COLLECTION_CAP = "INCIDENT_COLLECTION_CAP";
    static final String ENV_CONFIDENCE_THRESHOLD = "INCIDENT_CONFIDENCE_THRESHOLD";
    static final String ENV_MAX_STEP_ATTEMPTS = "INCIDENT_MAX_STEP_ATTEMPTS";
    static final String ENV_ADAPTER_TIMEOUT_SECONDS = "INCIDENT_ADAPTER_TIMEOUT_SECONDS";
    static final String ENV_ADAPTER_CONCURRENCY = "INCIDENT_ADAPTER_CONCURRENCY";
    static final String ENV_AUTO_EXECUTION = "INCIDENT_AUTO_EXECUTION";
    static final String ENV_MAX_RUN_SECONDS = "INCIDENT_MAX_RUN_SECONDS";
    static final String ENV_CHECKPOINT_TTL_SECONDS = "INCIDENT_CHECKPOINT_TTL_SECONDS";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public EngineConfigurationLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    EngineConfigurationLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public EngineSettings load() {
        return load(null);
    }

    /**
     * @param yamlFile optional YAML file; {@code null} skips it
     * @throws IllegalStateException when the file cannot be read or a value is malformed
     */
    public EngineSettings load(Path yamlFile) {
        EngineSettings.Builder builder = EngineSettings.builder();
        if (yamlFile != null) {
            applyYaml(builder, readYaml(yamlFile));
        }
        applyInt(ENV_MAX_CYCLES, resolve(ENV_MAX_CYCLES), builder::maxCycles);
        applyInt(ENV_COLLECTION_CAP, resolve(ENV_COLLECTION_CAP), builder::collectionCap);
        applyDouble(ENV_CONFIDENCE_THRESHOLD, resolve(ENV_CONFIDENCE_THRESHOLD), builder::confidenceThreshold);
        applyInt(ENV_MAX_STEP_ATTEMPTS, resolve(ENV_MAX_STEP_ATTEMPTS), builder::maxStepAttempts);
        applySeconds(ENV_ADAPTER_TIMEOUT_SECONDS, resolve(ENV_ADAPTER_TIMEOUT_SECONDS), builder::adapterTimeout);
        applyInt(ENV_ADAPTER_CONCURRENCY, resolve(ENV_ADAPTER_CONCURRENCY), builder::adapterConcurrency);
        applyBoolean(ENV_AUTO_EXECUTION, resolve(ENV_AUTO_EXECUTION), builder::autoExecution);
        applySeconds(ENV_MAX_RUN_SECONDS, resolve(ENV_MAX_RUN_SECONDS), builder::maxRunDuration);
        applySeconds(ENV_CHECKPOINT_TTL_SECONDS, resolve(ENV_CHECKPOINT_TTL_SECONDS), builder::checkpointTtl);
        try {
            return builder.build();
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid engine configuration: " + ex.getMessage(), ex);
        }
    }

    private void applyYaml(EngineSettings.Builder builder, Map<String, Object> yaml) {
        applyInt("maxCycles", string(yaml.get("maxCycles")), builder::maxCycles);
        applyInt("collectionCap", string(yaml.get("collectionCap")), builder::collectionCap);
        applyDouble("confidenceThreshold", string(yaml.get("confidenceThreshold")), builder::confidenceThreshold);
        applyInt("maxStepAttempts", string(yaml.get("maxStepAttempts")), builder::maxStepAttempts);
        applySeconds("adapterTimeoutSeconds", string(yaml.get("adapterTimeoutSeconds")), builder::adapterTimeout);
        applyInt("adapterConcurrency", string(yaml.get("adapterConcurrency")), builder::adapterConcurrency);
        applyBoolean("autoExecution", string(yaml.get("autoExecution")), builder::autoExecution);
        applySeconds("maxRunSeconds", string(yaml.get("maxRunSeconds")), builder::maxRunDuration);
        applySeconds("checkpointTtlSeconds", string(yaml.get("checkpointTtlSeconds")), builder::checkpointTtl);
    }

    private static Map<String, Object> readYaml(Path yamlFile) {
        if (!Files.isRegularFile(yamlFile)) {
            throw new IllegalStateException("Configuration file not found: " + yamlFile);
        }
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        try (InputStream in = Files.newInputStream(yamlFile)) {
            Object loaded = yaml.load(in);
            if (loaded == null) {
                return Map.of();
            }
            if (!(loaded instanceof Map<?, ?> map)) {
                throw new IllegalStateException("Configuration file must contain a mapping: " + yamlFile);
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> typed = (Map<String, Object>) map;
            return typed;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration file: " + yamlFile, ex);
        }
    }

    private String resolve(String key) {
        if (environment.containsKey(key)) {
            return environment.get(key);
        }
        return dotenv.get(key);
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }

    private static void applyInt(String key, String raw, Consumer<Integer> target) {
        String value = trimToNull(raw);
        if (value == null) {
            return;
        }
        try {
            target.accept(Integer.parseInt(value));
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(key + " must be an integer: " + value, ex);
        }
    }

    private static void applyDouble(String key, String raw, Consumer<Double> target) {
        String value = trimToNull(raw);
        if (value == null) {
            return;
        }
        try {
            target.accept(Double.parseDouble(value));
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(key + " must be a number: " + value, ex);
        }
    }

    private static void applySeconds(String key, String raw, Consumer<Duration> target) {
        String value = trimToNull(raw);
        if (value == null) {
            return;
        }
        long seconds;
        try {
            seconds = Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(key + " must be a positive integer (seconds): " + value, ex);
        }
        if (seconds <= 0) {
            throw new IllegalStateException(key + " must be greater than zero");
        }
        target.accept(Duration.ofSeconds(seconds));
    }

    private static void applyBoolean(String key, String raw, Consumer<Boolean> target) {
        String value = trimToNull(raw);
        if (value == null) {
            return;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> target.accept(true);
            case "false", "no", "0" -> target.accept(false);
            default -> throw new IllegalStateException(key + " must be true or false: " + value);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
