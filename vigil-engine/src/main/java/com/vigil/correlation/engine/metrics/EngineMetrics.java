package com.vigil.correlation.engine.metrics;

import com.vigil.correlation.infra.metrics.Counter;
import com.vigil.correlation.infra.metrics.MetricsRegistry;
import com.vigil.correlation.infra.metrics.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Engine-level counters.
 *
 * <p>Every count is kept twice: in a per-instance {@link LongAdder}, which
 * feeds {@code getEngineStats()} exactly, and in the injected
 * {@link MetricsRegistry}, which may be shared with other engines in the
 * same process.
 */
public final class EngineMetrics {

    public static final String EVENTS_RECEIVED = "correlation_events_received";
    public static final String EVENTS_PROCESSED = "correlation_events_processed";
    public static final String EVENTS_DROPPED = "correlation_events_dropped";
    public static final String RULE_EVALUATIONS = "correlation_rule_evaluations";
    public static final String RULE_EVALUATION_ERRORS = "correlation_rule_evaluation_errors";
    public static final String MATCHES = "correlation_matches";
    public static final String DISPATCH_REJECTED = "correlation_dispatch_rejected";
    public static final String CACHE_HITS = "correlation_cache_hits";
    public static final String CACHE_MISSES = "correlation_cache_misses";
    public static final String EVENT_PROCESSING = "correlation_event_processing";

    public static final String QUEUE_DEPTH = "correlation_queue_depth";
    public static final String P99_MS = "correlation_processing_p99_ms";
    public static final String AVERAGE_MS = "correlation_processing_average_ms";
    public static final String ACTIVE_RULES = "correlation_active_rules";

    public static final String CACHE_RULE = "rule";
    public static final String CACHE_FAST_PATH = "fast_path";

    private final MetricsRegistry registry;

    private final LongAdder received = new LongAdder();
    private final LongAdder processed = new LongAdder();
    private final LongAdder evaluations = new LongAdder();
    private final LongAdder evaluationErrors = new LongAdder();
    private final LongAdder matches = new LongAdder();
    private final LongAdder dispatchRejected = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final ConcurrentMap<String, LongAdder> dropped = new ConcurrentHashMap<>();

    private final Counter receivedCounter;
    private final Counter processedCounter;
    private final Counter evaluationCounter;
    private final Counter evaluationErrorCounter;
    private final Counter matchCounter;
    private final Counter dispatchRejectedCounter;
    private final Timer processingTimer;

    public EngineMetrics(MetricsRegistry registry) {
        this.registry = registry;
        this.receivedCounter = registry.counter(EVENTS_RECEIVED);
        this.processedCounter = registry.counter(EVENTS_PROCESSED);
        this.evaluationCounter = registry.counter(RULE_EVALUATIONS);
        this.evaluationErrorCounter = registry.counter(RULE_EVALUATION_ERRORS);
        this.matchCounter = registry.counter(MATCHES);
        this.dispatchRejectedCounter = registry.counter(DISPATCH_REJECTED);
        this.processingTimer = registry.timer(EVENT_PROCESSING);
    }

    public void eventReceived() {
        received.increment();
        receivedCounter.increment();
    }

    public void eventProcessed(Duration duration) {
        processed.increment();
        processedCounter.increment();
        processingTimer.record(duration);
    }

    public void eventDropped(String reason) {
        dropped.computeIfAbsent(reason, k -> new LongAdder()).increment();
        registry.counter(EVENTS_DROPPED, "reason", reason).increment();
    }

    public void ruleEvaluated() {
        evaluations.increment();
        evaluationCounter.increment();
    }

    public void evaluationFailed() {
        evaluationErrors.increment();
        evaluationErrorCounter.increment();
    }

    public void matched() {
        matches.increment();
        matchCounter.increment();
    }

    public void dispatchRejected() {
        dispatchRejected.increment();
        dispatchRejectedCounter.increment();
    }

    public void cacheHit(String cache) {
        cacheHits.increment();
        registry.counter(CACHE_HITS, "cache", cache).increment();
    }

    public void cacheMiss(String cache) {
        cacheMisses.increment();
        registry.counter(CACHE_MISSES, "cache", cache).increment();
    }

    public void updateGauges(int highQueued, int normalQueued, double p99Ms, double averageMs, int activeRules) {
        registry.gauge(QUEUE_DEPTH, "pool", "high").set(highQueued);
        registry.gauge(QUEUE_DEPTH, "pool", "normal").set(normalQueued);
        registry.gauge(P99_MS).set(p99Ms);
        registry.gauge(AVERAGE_MS).set(averageMs);
        registry.gauge(ACTIVE_RULES).set(activeRules);
    }

    public long received() { return received.sum(); }
    public long processed() { return processed.sum(); }
    public long ruleEvaluations() { return evaluations.sum(); }
    public long evaluationErrors() { return evaluationErrors.sum(); }
    public long matches() { return matches.sum(); }
    public long dispatchRejectedCount() { return dispatchRejected.sum(); }
    public long cacheHits() { return cacheHits.sum(); }
    public long cacheMisses() { return cacheMisses.sum(); }

    public long dropped(String reason) {
        LongAdder adder = dropped.get(reason);
        return adder == null ? 0L : adder.sum();
    }

    /**
     * Drop counts by reason, sorted by reason.
     */
    public Map<String, Long> droppedByReason() {
        Map<String, Long> snapshot = new TreeMap<>();
        dropped.forEach((reason, adder) -> snapshot.put(reason, adder.sum()));
        return snapshot;
    }
}
