package com.vigil.correlation.api.model;

/**
 * Partial update of {@link RuntimeConfig}. Null fields are left unchanged.
 */
public record RuntimeConfigPatch(
        Long maxProcessingTimeMs,
        Boolean batchProcessingEnabled,
        Integer batchSize,
        Long cacheExpirationMs,
        Boolean parallelRuleEvaluation,
        Boolean fastPathEnabled,
        Boolean streamProcessingMode,
        Boolean enableCircuitBreaker,
        Integer maxConcurrentEvents,
        Boolean priorityQueueEnabled) {

    public boolean isEmpty() {
        return maxProcessingTimeMs == null && batchProcessingEnabled == null && batchSize == null
                && cacheExpirationMs == null && parallelRuleEvaluation == null && fastPathEnabled == null
                && streamProcessingMode == null && enableCircuitBreaker == null
                && maxConcurrentEvents == null && priorityQueueEnabled == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long maxProcessingTimeMs;
        private Boolean batchProcessingEnabled;
        private Integer batchSize;
        private Long cacheExpirationMs;
        private Boolean parallelRuleEvaluation;
        private Boolean fastPathEnabled;
        private Boolean streamProcessingMode;
        private Boolean enableCircuitBreaker;
        private Integer maxConcurrentEvents;
        private Boolean priorityQueueEnabled;

        private Builder() {}

        public Builder maxProcessingTimeMs(long value) { this.maxProcessingTimeMs = value; return this; }
        public Builder batchProcessingEnabled(boolean value) { this.batchProcessingEnabled = value; return this; }
        public Builder batchSize(int value) { this.batchSize = value; return this; }
        public Builder cacheExpirationMs(long value) { this.cacheExpirationMs = value; return this; }
        public Builder parallelRuleEvaluation(boolean value) { this.parallelRuleEvaluation = value; return this; }
        public Builder fastPathEnabled(boolean value) { this.fastPathEnabled = value; return this; }
        public Builder streamProcessingMode(boolean value) { this.streamProcessingMode = value; return this; }
        public Builder enableCircuitBreaker(boolean value) { this.enableCircuitBreaker = value; return this; }
        public Builder maxConcurrentEvents(int value) { this.maxConcurrentEvents = value; return this; }
        public Builder priorityQueueEnabled(boolean value) { this.priorityQueueEnabled = value; return this; }

        public RuntimeConfigPatch build() {
            return new RuntimeConfigPatch(maxProcessingTimeMs, batchProcessingEnabled, batchSize,
                    cacheExpirationMs, parallelRuleEvaluation, fastPathEnabled, streamProcessingMode,
                    enableCircuitBreaker, maxConcurrentEvents, priorityQueueEnabled);
        }
    }
}
