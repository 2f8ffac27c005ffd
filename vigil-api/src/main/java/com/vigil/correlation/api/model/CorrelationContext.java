package com.vigil.correlation.api.model;

import java.time.Instant;
import java.util.Map;

/**
 * Context handed to the rule evaluator alongside each event.
 */
public record CorrelationContext(
        String eventId,
        Instant timestamp,
        String source,
        String eventType,
        Map<String, Object> metadata) {

    public static CorrelationContext of(Event event) {
        return new CorrelationContext(event.id(), event.timestamp(), event.source(),
                event.eventType(), event.metadata());
    }
}
