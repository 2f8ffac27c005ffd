package com.vigil.correlation.infra.metrics.impl.prometheus;

import com.vigil.correlation.infra.metrics.Timer;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bridges {@link Timer} to a Prometheus histogram.
 *
 * <p>Durations are observed in seconds, the Prometheus base unit. Percentiles
 * are left to the server:
 * <pre>
 * histogram_quantile(0.99, rate(correlation_event_processing_seconds_bucket[5m]))
 * </pre>
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        if (callable == null) {
            throw new IllegalArgumentException("Callable cannot be null");
        }
        io.prometheus.client.Histogram.Timer timer = histogram.startTimer();
        try {
            return callable.call();
        } finally {
            timer.observeDuration();
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public long count() {
        double[] buckets = histogram.get().buckets;
        // Cumulative buckets: the +Inf bucket holds the total count
        return buckets.length == 0 ? 0L : (long) buckets[buckets.length - 1];
    }
}
