package com.vigil.correlation.engine.admission;

import com.vigil.correlation.api.model.RuntimeConfig;

import java.util.function.IntSupplier;

/**
 * Decides whether an event may enter the pipeline.
 *
 * <p>Rejects when the circuit breaker is open (if enabled) or when the number
 * of in-flight events across both worker pools exceeds
 * {@link RuntimeConfig#maxConcurrentEvents()}. Rejection is a return value,
 * never an exception.
 */
public final class AdmissionController {

    public enum Decision {
        ADMITTED,
        CIRCUIT_OPEN,
        OVERLOAD
    }

    private final CircuitBreaker circuitBreaker;
    private final IntSupplier inFlight;

    public AdmissionController(CircuitBreaker circuitBreaker, IntSupplier inFlight) {
        this.circuitBreaker = circuitBreaker;
        this.inFlight = inFlight;
    }

    public Decision admit(RuntimeConfig config) {
        if (config.enableCircuitBreaker() && circuitBreaker.isOpen()) {
            return Decision.CIRCUIT_OPEN;
        }
        if (inFlight.getAsInt() > config.maxConcurrentEvents()) {
            return Decision.OVERLOAD;
        }
        return Decision.ADMITTED;
    }
}
