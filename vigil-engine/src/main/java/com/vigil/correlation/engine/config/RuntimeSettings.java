package com.vigil.correlation.engine.config;

import com.vigil.correlation.api.model.RuntimeConfig;
import com.vigil.correlation.api.model.RuntimeConfigPatch;

import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Holder of the current {@link RuntimeConfig} snapshot for one engine.
 *
 * <p>Reads are lock-free. Writers (the adaptive tuner and operator
 * overrides) go through {@link #apply(RuntimeConfigPatch)}, which merges
 * under a lock so two concurrent patches never lose each other's fields.
 */
public final class RuntimeSettings {

    private static final Logger logger = Logger.getLogger(RuntimeSettings.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private volatile RuntimeConfig current;

    public RuntimeSettings(RuntimeConfig initial) {
        this.current = initial;
    }

    public RuntimeConfig current() {
        return current;
    }

    /**
     * Merges the patch into the current snapshot.
     *
     * @return the snapshot in effect afterwards
     * @throws IllegalArgumentException if the merged values are invalid; the
     *                                  current snapshot is left unchanged
     */
    public RuntimeConfig apply(RuntimeConfigPatch patch) {
        lock.lock();
        try {
            RuntimeConfig merged = current.merge(patch);
            if (merged != current) {
                current = merged;
                logger.fine(() -> "Runtime configuration updated: " + merged);
            }
            return merged;
        } finally {
            lock.unlock();
        }
    }
}
