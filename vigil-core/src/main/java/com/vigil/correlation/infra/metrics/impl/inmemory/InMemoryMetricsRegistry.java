package com.vigil.correlation.infra.metrics.impl.inmemory;


import com.vigil.correlation.infra.metrics.Counter;
import com.vigil.correlation.infra.metrics.Gauge;
import com.vigil.correlation.infra.metrics.MetricsRegistry;
import com.vigil.correlation.infra.metrics.Timer;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry for testing.
 *
 * <p>Provides access to recorded values for assertions:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * engine = CorrelationEngine.builder()...metrics(metrics).build();
 *
 * assertThat(metrics.getCounterValue("correlation_events_dropped", "reason", "overload")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(MetricsRegistry.seriesKey(name, tags), InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(MetricsRegistry.seriesKey(name, tags), InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(MetricsRegistry.seriesKey(name, tags), InMemoryTimer::new);
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        Counter counter = counters.get(MetricsRegistry.seriesKey(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        Gauge gauge = gauges.get(MetricsRegistry.seriesKey(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(MetricsRegistry.seriesKey(name, tags));
        return timer != null ? timer.getRecordings() : Collections.emptyList();
    }

    public Duration getTimerPercentile(String name, double percentile, String... tags) {
        InMemoryTimer timer = timers.get(MetricsRegistry.seriesKey(name, tags));
        return timer != null ? timer.percentile(percentile) : Duration.ZERO;
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }
}
