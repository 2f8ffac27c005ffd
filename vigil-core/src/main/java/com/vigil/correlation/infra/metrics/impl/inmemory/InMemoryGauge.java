package com.vigil.correlation.infra.metrics.impl.inmemory;


import com.vigil.correlation.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link Gauge}. Stores the raw double bits so reads and writes
 * are single atomic operations.
 */
final class InMemoryGauge implements Gauge {

    private final String name;
    private final AtomicLong bits = new AtomicLong(Double.doubleToLongBits(0.0));

    InMemoryGauge(String name) {
        this.name = name;
    }

    @Override
    public void set(double newValue) {
        bits.set(Double.doubleToLongBits(newValue));
    }

    @Override
    public double value() {
        return Double.longBitsToDouble(bits.get());
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{name='%s', value=%.2f}", name, value());
    }
}
