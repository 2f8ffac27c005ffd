package com.vigil.correlation.api.model;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time snapshot of the engine for health and metrics endpoints.
 */
public record EngineStats(
        int activeRules,
        IndexStats index,
        QueueStats queues,
        CacheStats cache,
        PerformanceStats performance,
        CircuitBreakerStats circuitBreaker,
        BufferStats buffers,
        BatchStats batch,
        Map<String, Long> droppedByReason,
        long dispatchRejected,
        RuntimeConfig runtimeConfig,
        Instant timestamp) {

    public EngineStats {
        droppedByReason = droppedByReason == null ? Map.of() : Map.copyOf(droppedByReason);
    }

    public record IndexStats(int indexedKeyCount, int membershipEntries, int totalIndexEntries) {
    }

    /**
     * @param batchBacklog events waiting in the current batch or in flushed
     *                     batches that have not finished processing
     */
    public record QueueStats(int highPriorityQueued, int normalPriorityQueued,
                             int highPriorityActive, int normalPriorityActive, long expiredTasks,
                             int batchBacklog) {
        public int totalQueued() {
            return highPriorityQueued + normalPriorityQueued + batchBacklog;
        }
    }

    public record CacheStats(long ruleCacheSize, long fastPathCacheSize, long hits, long misses) {
        public double hitRatio() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }

    public record PerformanceStats(double averageProcessingMs, double p99ProcessingMs, int samples,
                                   long eventsReceived, long eventsProcessed, long ruleEvaluations,
                                   long evaluationErrors, long matches) {
    }

    public record CircuitBreakerStats(boolean open, int failures, int threshold, long timeoutMs) {
        public String status() {
            return open ? "open" : "closed";
        }
    }

    public record BufferStats(int totalEvents, int keys) {
    }

    public record BatchStats(int pendingEvents, int lastBatchSize, long lastBatchProcessingMs,
                             double throughputEventsPerSecond, long batchesFlushed) {
    }
}
