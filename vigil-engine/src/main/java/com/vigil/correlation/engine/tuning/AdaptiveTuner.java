/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.engine.tuning;

import com.vigil.correlation.api.model.RuntimeConfig;
import com.vigil.correlation.api.model.RuntimeConfigPatch;
import com.vigil.correlation.engine.config.RuntimeSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Periodic control loop over the runtime tunables.
 *
 * <p>Rules, evaluated against one snapshot and applied as a single patch:
 * <ol>
 *   <li>average latency below half the target and stream mode off: enable stream mode</li>
 *   <li>a queue deeper than the threshold and batch mode off: enable batch mode</li>
 *   <li>average latency above the target and batch size above the floor:
 *       shrink batch size by the step, not below the floor</li>
 * </ol>
 * Latency rules need at least the window's minimum sample count. The tuner
 * only ratchets: it never turns a mode off again.
 */
public final class AdaptiveTuner {

    private static final Logger logger = Logger.getLogger(AdaptiveTuner.class.getName());

    private final RuntimeSettings settings;
    private final PerformanceWindow window;
    private final int queueThreshold;
    private final int batchFloor;
    private final int batchStep;

    public AdaptiveTuner(RuntimeSettings settings, PerformanceWindow window,
                         int queueThreshold, int batchFloor, int batchStep) {
        this.settings = settings;
        this.window = window;
        this.queueThreshold = queueThreshold;
        this.batchFloor = batchFloor;
        this.batchStep = batchStep;
    }

    /**
     * Runs one tuning pass.
     *
     * @param queueDepths current depth of each worker queue
     * @return the patch applied, empty if nothing changed
     */
    public RuntimeConfigPatch tune(int... queueDepths) {
        RuntimeConfig config = settings.current();
        boolean enoughSamples = window.sampleCount() >= window.minSamples();
        double average = window.average();
        long target = config.maxProcessingTimeMs();

        RuntimeConfigPatch.Builder patch = RuntimeConfigPatch.builder();
        List<String> changes = new ArrayList<>();

        if (enoughSamples && average < target * 0.5 && !config.streamProcessingMode()) {
            patch.streamProcessingMode(true);
            changes.add(String.format("stream mode on (avg %.1f ms < %.1f ms)", average, target * 0.5));
        }

        int deepest = 0;
        for (int depth : queueDepths) {
            deepest = Math.max(deepest, depth);
        }
        if (deepest > queueThreshold && !config.batchProcessingEnabled()) {
            patch.batchProcessingEnabled(true);
            changes.add(String.format("batch mode on (queue depth %d > %d)", deepest, queueThreshold));
        }

        if (enoughSamples && average > target && config.batchSize() > batchFloor) {
            int newSize = Math.max(batchFloor, config.batchSize() - batchStep);
            patch.batchSize(newSize);
            changes.add(String.format("batch size %d -> %d (avg %.1f ms > %d ms)",
                    config.batchSize(), newSize, average, target));
        }

        RuntimeConfigPatch built = patch.build();
        if (!built.isEmpty()) {
            settings.apply(built);
            logger.info("Adaptive tuning: " + String.join(", ", changes));
        }
        return built;
    }
}
