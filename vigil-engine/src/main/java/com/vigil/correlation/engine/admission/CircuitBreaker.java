/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.engine.admission;

import com.vigil.correlation.api.model.EngineStats;

import java.time.Clock;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Failure-counting circuit breaker guarding event admission.
 *
 * <p>The breaker is open while {@code failures >= threshold} and less than
 * {@code timeout} has passed since the last failure. The first check after
 * the timeout closes it and resets the count to zero; there is no trial
 * phase.
 *
 * <p>Accounting per processed event:
 * <ul>
 *   <li>success within budget: failures decremented, floor zero</li>
 *   <li>success over budget: failures incremented</li>
 *   <li>exception: failures incremented and the failure time recorded</li>
 * </ul>
 * Only exceptions move the failure time, so a run of slow events can trip
 * the count without holding the breaker open.
 */
public final class CircuitBreaker {

    private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

    private final int threshold;
    private final long timeoutMs;
    private final Clock clock;

    private int failures;
    private long lastFailureTime;

    public CircuitBreaker(int threshold, Duration timeout, Clock clock) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        this.threshold = threshold;
        this.timeoutMs = timeout.toMillis();
        this.clock = clock;
    }

    /**
     * Whether admission must be refused. Closes the breaker as a side effect
     * once the timeout has elapsed.
     */
    public synchronized boolean isOpen() {
        if (failures >= threshold) {
            if (clock.millis() - lastFailureTime < timeoutMs) {
                return true;
            }
            logger.info(String.format("Circuit breaker closed after %d ms, resetting %d failures",
                    timeoutMs, failures));
            failures = 0;
        }
        return false;
    }

    public synchronized void recordSuccess() {
        if (failures > 0) {
            failures--;
        }
    }

    public synchronized void recordSlow() {
        failures++;
    }

    public synchronized void recordFailure() {
        failures++;
        lastFailureTime = clock.millis();
        if (failures == threshold) {
            logger.warning(String.format("Circuit breaker opened after %d failures", failures));
        }
    }

    public synchronized int failures() {
        return failures;
    }

    public int threshold() {
        return threshold;
    }

    /**
     * Snapshot for stats. Does not close the breaker.
     */
    public synchronized EngineStats.CircuitBreakerStats snapshot() {
        boolean open = failures >= threshold && clock.millis() - lastFailureTime < timeoutMs;
        return new EngineStats.CircuitBreakerStats(open, failures, threshold, timeoutMs);
    }
}
