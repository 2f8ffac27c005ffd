package com.vigil.correlation.infra.metrics;

import com.vigil.correlation.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}.
 * Tags are passed as alternating key/value pairs; each distinct set of tag
 * values yields its own series.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("correlation_events_dropped", "reason", "overload").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a gauge metric.
     */
    Gauge gauge(String name, String... tags);

    /**
     * Creates or retrieves a timer histogram.
     */
    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry instance, discovered via ServiceLoader.
     * Falls back to no-op if no provider is found.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    /**
     * A registry that records nothing.
     */
    static MetricsRegistry noop() {
        return MetricsRegistryHolder.NOOP;
    }

    /**
     * Builds the lookup key of a series from its name and tags.
     */
    static String seriesKey(String name, String... tags) {
        if (tags == null || tags.length == 0) {
            return name;
        }
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs for metric " + name);
        }
        StringBuilder key = new StringBuilder(name).append('{');
        for (int i = 0; i < tags.length; i += 2) {
            if (i > 0) {
                key.append(',');
            }
            key.append(tags[i]).append('=').append(tags[i + 1]);
        }
        return key.append('}').toString();
    }
}
