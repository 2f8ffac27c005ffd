package com.vigil.correlation.api.model;

import java.time.Instant;
import java.util.Map;

/**
 * Incident as returned by the incident manager. The engine treats it as
 * opaque apart from its identifier.
 */
public record Incident(
        String id,
        String ruleId,
        String incidentType,
        Severity severity,
        String title,
        String status,
        int eventCount,
        Instant firstSeen,
        Instant lastSeen,
        Map<String, Object> metadata) {

    public Incident {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
