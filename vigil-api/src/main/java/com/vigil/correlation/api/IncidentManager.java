package com.vigil.correlation.api;

import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Incident;
import com.vigil.correlation.api.model.IncidentDraft;

import java.time.Instant;
import java.util.Optional;

/**
 * Incident persistence and deduplication.
 */
public interface IncidentManager {

    /**
     * Finds an open incident raised by {@code ruleId} within the last
     * {@code windowMinutes} that the event should be folded into.
     */
    Optional<Incident> findOpenIncident(String ruleId, Event event, int windowMinutes);

    Incident createIncident(IncidentDraft draft);

    Incident updateIncident(String incidentId, Event event, EvaluationResult result);

    /**
     * Links an event to an existing incident with a relevance score.
     */
    void addCorrelatedEvent(String incidentId, String eventId, Instant eventTimestamp, double relevanceScore);
}
