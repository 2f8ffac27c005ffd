package com.vigil.correlation.api.model;

import java.util.concurrent.CompletableFuture;

/**
 * Result of handing an event to the engine.
 *
 * <p>Rejections are reported here instead of being thrown. The completion
 * future finishes (always normally) once the engine is done with the event:
 * immediately for rejections, after evaluation for routed and streamed
 * events, and after the containing batch is flushed for batched events.
 * Match dispatch is never part of the completion.
 */
public record ProcessingOutcome(Disposition disposition, CompletableFuture<Void> completion) {

    public enum Disposition {
        ROUTED_HIGH,
        ROUTED_NORMAL,
        STREAMED,
        BATCHED,
        REJECTED_CIRCUIT_OPEN,
        REJECTED_OVERLOAD,
        REJECTED_INVALID,
        REJECTED_SHUTDOWN;

        public boolean isRejected() {
            return name().startsWith("REJECTED");
        }
    }

    public static ProcessingOutcome rejected(Disposition disposition) {
        return new ProcessingOutcome(disposition, CompletableFuture.completedFuture(null));
    }

    public boolean accepted() {
        return !disposition.isRejected();
    }
}
