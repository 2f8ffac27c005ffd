package com.vigil.correlation.engine.metrics;

import com.vigil.correlation.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class EngineMetricsTest {

    private InMemoryMetricsRegistry registry;
    private EngineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new InMemoryMetricsRegistry();
        metrics = new EngineMetrics(registry);
    }

    @Test
    void countersShouldBeMirroredToRegistry() {
        metrics.eventReceived();
        metrics.eventReceived();
        metrics.eventProcessed(Duration.ofMillis(12));
        metrics.ruleEvaluated();
        metrics.evaluationFailed();
        metrics.matched();
        metrics.dispatchRejected();

        assertThat(metrics.received()).isEqualTo(2);
        assertThat(registry.getCounterValue(EngineMetrics.EVENTS_RECEIVED)).isEqualTo(2);
        assertThat(registry.getCounterValue(EngineMetrics.EVENTS_PROCESSED)).isEqualTo(1);
        assertThat(registry.getCounterValue(EngineMetrics.RULE_EVALUATIONS)).isEqualTo(1);
        assertThat(registry.getCounterValue(EngineMetrics.RULE_EVALUATION_ERRORS)).isEqualTo(1);
        assertThat(registry.getCounterValue(EngineMetrics.MATCHES)).isEqualTo(1);
        assertThat(registry.getCounterValue(EngineMetrics.DISPATCH_REJECTED)).isEqualTo(1);
        assertThat(registry.getTimerRecordings(EngineMetrics.EVENT_PROCESSING)).containsExactly(Duration.ofMillis(12));
    }

    @Test
    void dropsShouldBeTaggedByReason() {
        metrics.eventDropped("overload");
        metrics.eventDropped("overload");
        metrics.eventDropped("circuit_open");

        assertThat(metrics.dropped("overload")).isEqualTo(2);
        assertThat(metrics.dropped("shutdown")).isZero();
        assertThat(metrics.droppedByReason()).containsExactly(
                entry("circuit_open", 1L),
                entry("overload", 2L));
        assertThat(registry.getCounterValue(EngineMetrics.EVENTS_DROPPED, "reason", "overload")).isEqualTo(2);
    }

    @Test
    void cacheCountersShouldBeTaggedByCache() {
        metrics.cacheHit(EngineMetrics.CACHE_RULE);
        metrics.cacheMiss(EngineMetrics.CACHE_FAST_PATH);
        metrics.cacheMiss(EngineMetrics.CACHE_FAST_PATH);

        assertThat(metrics.cacheHits()).isEqualTo(1);
        assertThat(metrics.cacheMisses()).isEqualTo(2);
        assertThat(registry.getCounterValue(EngineMetrics.CACHE_HITS, "cache", "rule")).isEqualTo(1);
        assertThat(registry.getCounterValue(EngineMetrics.CACHE_MISSES, "cache", "fast_path")).isEqualTo(2);
    }

    @Test
    void gaugesShouldReflectLastUpdate() {
        metrics.updateGauges(3, 7, 42.0, 11.5, 120);

        assertThat(registry.getGaugeValue(EngineMetrics.QUEUE_DEPTH, "pool", "high")).isEqualTo(3.0);
        assertThat(registry.getGaugeValue(EngineMetrics.QUEUE_DEPTH, "pool", "normal")).isEqualTo(7.0);
        assertThat(registry.getGaugeValue(EngineMetrics.P99_MS)).isEqualTo(42.0);
        assertThat(registry.getGaugeValue(EngineMetrics.AVERAGE_MS)).isEqualTo(11.5);
        assertThat(registry.getGaugeValue(EngineMetrics.ACTIVE_RULES)).isEqualTo(120.0);
    }
}
