package com.vigil.correlation.engine.tuning;

import java.util.Arrays;

/**
 * Rolling window of event processing times.
 *
 * <p>Holds the last {@code capacity} samples in a ring buffer. The average
 * is an exponential moving average seeded with the first sample; the P99 is
 * computed from the ring only once {@code minSamples} samples are present
 * and reads 0 before that.
 */
public final class PerformanceWindow {

    private final long[] samples;
    private final int minSamples;
    private final double alpha;

    private int next;
    private int size;
    private double average;
    private boolean seeded;

    public PerformanceWindow(int capacity, int minSamples, double alpha) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.samples = new long[capacity];
        this.minSamples = minSamples;
        this.alpha = alpha;
    }

    public synchronized void record(long millis) {
        samples[next] = millis;
        next = (next + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
        if (!seeded) {
            average = millis;
            seeded = true;
        } else {
            average = alpha * millis + (1 - alpha) * average;
        }
    }

    public synchronized double average() {
        return average;
    }

    public synchronized double p99() {
        if (size < minSamples || size == 0) {
            return 0.0;
        }
        long[] sorted = Arrays.copyOf(samples, size);
        Arrays.sort(sorted);
        int index = Math.min((int) Math.floor(size * 0.99), size - 1);
        return sorted[index];
    }

    public synchronized int sampleCount() {
        return size;
    }

    public int minSamples() {
        return minSamples;
    }
}
