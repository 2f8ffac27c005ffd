package com.vigil.correlation.infra.metrics.impl.prometheus;


import com.vigil.correlation.infra.metrics.Counter;
import com.vigil.correlation.infra.metrics.Gauge;
import com.vigil.correlation.infra.metrics.MetricsRegistry;
import com.vigil.correlation.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus implementation of MetricsRegistry.
 *
 * <p>One collector is registered per metric name; each distinct set of tag
 * values is bound to its own child. A name must always be used with the same
 * tag keys.
 * Thread-safe.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private static final double[] LATENCY_BUCKETS =
            {0.001, 0.005, 0.01, 0.05, 0.1, 0.2, 0.5, 1.0, 5.0};

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> counterCollectors = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Gauge> gaugeCollectors = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Histogram> timerCollectors = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(MetricsRegistry.seriesKey(name, tags), key -> {
            io.prometheus.client.Counter collector = counterCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Counter.build()
                            .name(sanitizeName(n))
                            .help("Counter " + n)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new PrometheusCounterAdapter(collector, extractLabelValues(tags));
        });
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(MetricsRegistry.seriesKey(name, tags), key -> {
            io.prometheus.client.Gauge collector = gaugeCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Gauge.build()
                            .name(sanitizeName(n))
                            .help("Gauge " + n)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new PrometheusGaugeAdapter(collector, extractLabelValues(tags));
        });
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(MetricsRegistry.seriesKey(name, tags), key -> {
            io.prometheus.client.Histogram collector = timerCollectors.computeIfAbsent(name, n ->
                    io.prometheus.client.Histogram.build()
                            .name(sanitizeName(n) + "_seconds")
                            .help("Timer " + n)
                            .buckets(LATENCY_BUCKETS)
                            .labelNames(extractLabelNames(tags))
                            .register(registry));
            return new PrometheusTimerAdapter(collector, extractLabelValues(tags));
        });
    }

    CollectorRegistry collectorRegistry() {
        return registry;
    }

    static String sanitizeName(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String[] extractLabelNames(String[] tags) {
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = sanitizeName(tags[i * 2]);
        }
        return labels;
    }

    private static String[] extractLabelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }
}
