package com.vigil.correlation.infra.metrics.impl.inmemory;

import com.vigil.correlation.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link Timer} for tests. Keeps every recorded duration so that
 * assertions and percentile calculations can be made against them.
 */
final class InMemoryTimer implements Timer {

    private final String name;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String name) {
        this.name = name;
    }

    @Override
    public <T> T record(Callable<T> callable) throws Exception {
        long startNanos = System.nanoTime();
        try {
            return callable.call();
        } finally {
            recordings.add(Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    @Override
    public long count() {
        return recordings.size();
    }

    /**
     * Linear-interpolated percentile of the recorded durations.
     *
     * @param percentile value between 0.0 and 1.0
     */
    Duration percentile(double percentile) {
        if (recordings.isEmpty()) {
            return Duration.ZERO;
        }
        double p = Math.max(0.0, Math.min(1.0, percentile));

        List<Duration> sorted = new ArrayList<>(recordings);
        Collections.sort(sorted);
        if (sorted.size() == 1) {
            return sorted.get(0);
        }

        double index = (sorted.size() - 1) * p;
        int lowerIndex = (int) Math.floor(index);
        int upperIndex = (int) Math.ceil(index);
        if (lowerIndex == upperIndex) {
            return sorted.get(lowerIndex);
        }

        Duration lower = sorted.get(lowerIndex);
        Duration upper = sorted.get(upperIndex);
        double fraction = index - lowerIndex;
        long interpolatedNanos = lower.toNanos()
                + (long) ((upper.toNanos() - lower.toNanos()) * fraction);
        return Duration.ofNanos(interpolatedNanos);
    }

    List<Duration> getRecordings() {
        return Collections.unmodifiableList(new ArrayList<>(recordings));
    }

    @Override
    public String toString() {
        return String.format("InMemoryTimer{name='%s', count=%d, p99=%s}",
                name, count(), percentile(0.99));
    }
}
