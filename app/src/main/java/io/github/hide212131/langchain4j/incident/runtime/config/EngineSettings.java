package io.github.hide212131.langchain4j.incident.runtime.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds and switches of one workflow engine.
 *
 * @param maxCycles router cycles per session before it is force-terminated
 * @param collectionCap suspensions per session before it ends as collection-exhausted
 * @param confidenceThreshold diagnoses below this confidence trigger a clarification request
 * @param maxStepAttempts adapter failures per step before the session is routed to reporting
 * @param adapterTimeout upper bound for a single adapter call
 * @param adapterConcurrency adapter calls in flight across all sessions of the engine
 * @param autoExecution when false every plan waits for operator approval
 * @param maxRunDuration wall-clock bound for one start or resume drive
 * @param checkpointTtl how long a suspended session may wait before it is discarded
 */
public record EngineSettings(
        int maxCycles,
        int collectionCap,
        double confidenceThreshold,
        int maxStepAttempts,
        Duration adapterTimeout,
        int adapterConcurrency,
        boolean autoExecution,
        Duration maxRunDuration,
        Duration checkpointTtl) {

    public static final int DEFAULT_MAX_CYCLES = 50;
    public static final int DEFAULT_COLLECTION_CAP = 5;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.6;
    public static final int DEFAULT_MAX_STEP_ATTEMPTS = 3;
    public static final Duration DEFAULT_ADAPTER_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_ADAPTER_CONCURRENCY = 8;
    public static final Duration DEFAULT_MAX_RUN_DURATION = Duration.ofMinutes(10);
    public static final Duration DEFAULT_CHECKPOINT_TTL = Duration.ofMinutes(30);

    public EngineSettings {
        requirePositive("maxCycles", maxCycles);
        requirePositive("collectionCap", collectionCap);
        requirePositive("maxStepAttempts", maxStepAttempts);
        requirePositive("adapterConcurrency", adapterConcurrency);
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0,1]: " + confidenceThreshold);
        }
        requirePositive("adapterTimeout", adapterTimeout);
        requirePositive("maxRunDuration", maxRunDuration);
        requirePositive("checkpointTtl", checkpointTtl);
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxCycles(maxCycles)
                .collectionCap(collectionCap)
                .confidenceThreshold(confidenceThreshold)
                .maxStepAttempts(maxStepAttempts)
                .adapterTimeout(adapterTimeout)
                .adapterConcurrency(adapterConcurrency)
                .autoExecution(autoExecution)
                .maxRunDuration(maxRunDuration)
                .checkpointTtl(checkpointTtl);
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static void requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    public static final class Builder {
        private int maxCycles = DEFAULT_MAX_CYCLES;
        private int collectionCap = DEFAULT_COLLECTION_CAP;
        private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
        private int maxStepAttempts = DEFAULT_MAX_STEP_ATTEMPTS;
        private Duration adapterTimeout = DEFAULT_ADAPTER_TIMEOUT;
        private int adapterConcurrency = DEFAULT_ADAPTER_CONCURRENCY;
        private boolean autoExecution = true;
        private Duration maxRunDuration = DEFAULT_MAX_RUN_DURATION;
        private Duration checkpointTtl = DEFAULT_CHECKPOINT_TTL;

        private Builder() {
        }

        public Builder maxCycles(int value) {
            this.maxCycles = value;
            return this;
        }

        public Builder collectionCap(int value) {
            this.collectionCap = value;
            return this;
        }

        public Builder confidenceThreshold(double value) {
            this.confidenceThreshold = value;
            return this;
        }

        public Builder maxStepAttempts(int value) {
            this.maxStepAttempts = value;
            return this;
        }

        public Builder adapterTimeout(Duration value) {
            this.adapterTimeout = value;
            return this;
        }

        public Builder adapterConcurrency(int value) {
            this.adapterConcurrency = value;
            return this;
        }

        public Builder autoExecution(boolean value) {
            this.autoExecution = value;
            return this;
        }

        public Builder maxRunDuration(Duration value) {
            this.maxRunDuration = value;
            return this;
        }

        public Builder checkpointTtl(Duration value) {
            this.checkpointTtl = value;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(maxCycles, collectionCap, confidenceThreshold, maxStepAttempts, adapterTimeout,
                    adapterConcurrency, autoExecution, maxRunDuration, checkpointTtl);
        }
    }
}
