package com.vigil.correlation.api.model;

import java.util.List;

/**
 * A cross-event detection produced by the pattern matcher.
 *
 * @param id             pattern identifier
 * @param name           pattern display name
 * @param patternType    pattern family ("brute_force", "lateral_movement", ...)
 * @param description    explanation of the detection
 * @param severity       severity of the resulting incident
 * @param relevanceScore score attached to each correlated event
 * @param matchedEvents  events that make up the pattern
 */
public record PatternMatch(
        String id,
        String name,
        String patternType,
        String description,
        Severity severity,
        double relevanceScore,
        List<Event> matchedEvents) {

    public PatternMatch {
        matchedEvents = matchedEvents == null ? List.of() : List.copyOf(matchedEvents);
    }
}
