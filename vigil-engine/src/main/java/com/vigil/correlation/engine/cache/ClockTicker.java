package com.vigil.correlation.engine.cache;

import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine {@link Ticker} driven by a {@link Clock}, so cache expiry follows
 * the same time source as the rest of the engine.
 */
public final class ClockTicker implements Ticker {

    private final Clock clock;

    public ClockTicker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long read() {
        return TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }
}
