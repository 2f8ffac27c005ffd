/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.api;

import com.vigil.correlation.api.exceptions.RuleLoadException;
import com.vigil.correlation.api.model.EngineStats;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.ProcessingOutcome;
import com.vigil.correlation.api.model.RuntimeConfig;
import com.vigil.correlation.api.model.RuntimeConfigPatch;

/**
 * Contract of the real-time correlation engine.
 *
 * <p>Events enter through {@link #processEvent(Event)}, which never throws:
 * overload, an open circuit breaker or a shut-down engine are reported as a
 * rejected {@link ProcessingOutcome}. Matches are handed to the incident and
 * action collaborators asynchronously.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #initialize()} loads the rules and starts the background loops</li>
 *   <li>{@link #processEvent(Event)} is called concurrently by ingestion threads</li>
 *   <li>{@link #shutdown()} drains pending work and releases collaborators</li>
 * </ol>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods are safe to call concurrently, including
 * {@link #reloadRules()} while traffic is flowing.
 */
public interface ICorrelationEngine extends AutoCloseable {

    /**
     * Loads the initial rule set and starts the periodic loops. A rule load
     * failure is logged and the engine starts with no active rules.
     */
    void initialize();

    /**
     * Primary ingress. Never throws.
     */
    ProcessingOutcome processEvent(Event event);

    /**
     * Rebuilds the rule index from the rule store and swaps it in atomically.
     *
     * @throws RuleLoadException if the rules could not be loaded; the previous index stays active
     */
    void reloadRules() throws RuleLoadException;

    EngineStats getEngineStats();

    /**
     * Applies an operator override on top of the current runtime tunables.
     *
     * @return the resulting configuration
     * @throws IllegalArgumentException if the merged configuration is invalid
     */
    RuntimeConfig updateRuntimeConfig(RuntimeConfigPatch patch);

    RuntimeConfig getRuntimeConfig();

    void enableStreamMode();

    void disableStreamMode();

    /**
     * Drains in-flight batches and queues, then closes collaborators. Idempotent.
     */
    void shutdown();

    @Override
    default void close() {
        shutdown();
    }
}
