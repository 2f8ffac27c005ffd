/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable snapshot of the runtime tunables.
 *
 * <p>Every in-flight operation reads the snapshot that is current when it
 * starts. Changes (from the adaptive tuner or an operator) produce a new
 * snapshot through {@link #merge(RuntimeConfigPatch)}; nothing mutates a
 * snapshot in place.
 */
public record RuntimeConfig(
        @JsonProperty("max_processing_time_ms") long maxProcessingTimeMs,
        @JsonProperty("batch_processing_enabled") boolean batchProcessingEnabled,
        @JsonProperty("batch_size") int batchSize,
        @JsonProperty("cache_expiration_ms") long cacheExpirationMs,
        @JsonProperty("parallel_rule_evaluation") boolean parallelRuleEvaluation,
        @JsonProperty("fast_path_enabled") boolean fastPathEnabled,
        @JsonProperty("stream_processing_mode") boolean streamProcessingMode,
        @JsonProperty("enable_circuit_breaker") boolean enableCircuitBreaker,
        @JsonProperty("max_concurrent_events") int maxConcurrentEvents,
        @JsonProperty("priority_queue_enabled") boolean priorityQueueEnabled) {

    public static final long DEFAULT_MAX_PROCESSING_TIME_MS = 200;
    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final long DEFAULT_CACHE_EXPIRATION_MS = 30_000;
    public static final int DEFAULT_MAX_CONCURRENT_EVENTS = 1000;

    public RuntimeConfig {
        if (maxProcessingTimeMs <= 0) {
            throw new IllegalArgumentException("maxProcessingTimeMs must be positive: " + maxProcessingTimeMs);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        if (cacheExpirationMs <= 0) {
            throw new IllegalArgumentException("cacheExpirationMs must be positive: " + cacheExpirationMs);
        }
        if (maxConcurrentEvents <= 0) {
            throw new IllegalArgumentException("maxConcurrentEvents must be positive: " + maxConcurrentEvents);
        }
    }

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(
                DEFAULT_MAX_PROCESSING_TIME_MS,
                false,
                DEFAULT_BATCH_SIZE,
                DEFAULT_CACHE_EXPIRATION_MS,
                true,
                true,
                false,
                true,
                DEFAULT_MAX_CONCURRENT_EVENTS,
                true);
    }

    /**
     * Returns a new snapshot with every non-null field of the patch applied.
     *
     * @throws IllegalArgumentException if the merged values are out of range
     */
    public RuntimeConfig merge(RuntimeConfigPatch patch) {
        if (patch == null || patch.isEmpty()) {
            return this;
        }
        return new RuntimeConfig(
                patch.maxProcessingTimeMs() != null ? patch.maxProcessingTimeMs() : maxProcessingTimeMs,
                patch.batchProcessingEnabled() != null ? patch.batchProcessingEnabled() : batchProcessingEnabled,
                patch.batchSize() != null ? patch.batchSize() : batchSize,
                patch.cacheExpirationMs() != null ? patch.cacheExpirationMs() : cacheExpirationMs,
                patch.parallelRuleEvaluation() != null ? patch.parallelRuleEvaluation() : parallelRuleEvaluation,
                patch.fastPathEnabled() != null ? patch.fastPathEnabled() : fastPathEnabled,
                patch.streamProcessingMode() != null ? patch.streamProcessingMode() : streamProcessingMode,
                patch.enableCircuitBreaker() != null ? patch.enableCircuitBreaker() : enableCircuitBreaker,
                patch.maxConcurrentEvents() != null ? patch.maxConcurrentEvents() : maxConcurrentEvents,
                patch.priorityQueueEnabled() != null ? patch.priorityQueueEnabled() : priorityQueueEnabled);
    }
}
