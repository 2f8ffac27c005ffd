package com.vigil.correlation.infra.metrics.impl.inmemory;


import com.vigil.correlation.infra.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

final class InMemoryCounter implements Counter {
    private final LongAdder value = new LongAdder();
    private final String name;

    InMemoryCounter(String name) {
        this.name = name;
    }

    @Override
    public void increment() {
        value.increment();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
        }
        value.add(amount);
    }

    @Override
    public long count() {
        return value.sum();
    }

    @Override
    public String toString() {
        return String.format("InMemoryCounter{name='%s', count=%d}", name, count());
    }
}
