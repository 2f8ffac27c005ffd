package com.vigil.correlation.api.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Data needed to create a new incident, either from a rule match or from a
 * cross-event pattern match. Exactly one of {@code ruleId} and
 * {@code patternId} is set.
 */
public record IncidentDraft(
        String ruleId,
        String patternId,
        String incidentType,
        Severity severity,
        String title,
        String description,
        Instant firstSeen,
        Instant lastSeen,
        int eventCount,
        List<String> affectedAssets,
        Map<String, Object> metadata) {

    public IncidentDraft {
        affectedAssets = affectedAssets == null ? List.of() : List.copyOf(affectedAssets);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
