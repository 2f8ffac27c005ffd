package com.vigil.correlation.engine.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.IncidentDraft;
import com.vigil.correlation.api.model.PatternMatch;
import com.vigil.correlation.api.model.Rule;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Shapes incident drafts from rule and pattern matches.
 */
public final class IncidentFactory {

    private static final Logger logger = Logger.getLogger(IncidentFactory.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    static final String DEFAULT_DESCRIPTION = "Security incident detected.";

    private final Clock clock;

    public IncidentFactory(Clock clock) {
        this.clock = clock;
    }

    public IncidentDraft fromRuleMatch(Rule rule, Event event, EvaluationResult result) {
        Instant seen = event.timestamp() != null ? event.timestamp() : clock.instant();
        Map<String, Object> metadata = new LinkedHashMap<>(result.metadata());
        metadata.put("confidence", result.confidence());
        metadata.put("triggering_event_id", event.id());
        return new IncidentDraft(
                rule.id(),
                null,
                rule.type(),
                rule.severity(),
                title(rule, event),
                description(rule, event, result),
                seen,
                seen,
                1,
                affectedAssets(List.of(event)),
                metadata);
    }

    public IncidentDraft fromPattern(PatternMatch pattern, Event trigger) {
        List<Event> events = pattern.matchedEvents().isEmpty() ? List.of(trigger) : pattern.matchedEvents();
        Instant first = null;
        Instant last = null;
        for (Event e : events) {
            Instant ts = e.timestamp() != null ? e.timestamp() : clock.instant();
            first = first == null || ts.isBefore(first) ? ts : first;
            last = last == null || ts.isAfter(last) ? ts : last;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("pattern_type", pattern.patternType());
        metadata.put("relevance_score", pattern.relevanceScore());
        return new IncidentDraft(
                null,
                pattern.id(),
                pattern.patternType(),
                pattern.severity(),
                "Pattern: " + pattern.name(),
                pattern.description(),
                first,
                last,
                events.size(),
                affectedAssets(events),
                metadata);
    }

    static String title(Rule rule, Event event) {
        String name = rule.name() != null ? rule.name() : rule.id();
        String category = rule.category() == null ? "" : rule.category();
        switch (category) {
            case "authentication":
                return String.format("Auth Alert: %s (%s)", name, orUnknown(event.userName()));
            case "network":
                return String.format("Network: %s (%s)", name, orUnknown(event.ipAddress()));
            case "malware":
                return String.format("Malware: %s (%s)", name, orUnknown(event.computerName()));
            case "data_exfiltration":
                return "Data Exfil: " + name;
            case "privilege_escalation":
                return "PrivEsc: " + name;
            case "lateral_movement":
                return "Lateral: " + name;
            default:
                return "Security: " + name;
        }
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }

    static String description(Rule rule, Event event, EvaluationResult result) {
        List<String> parts = new ArrayList<>(3);
        parts.add(rule.description() != null && !rule.description().isBlank()
                ? rule.description()
                : DEFAULT_DESCRIPTION);
        parts.add(String.format("Event: %s from %s at %s",
                event.eventType(), event.source(), event.timestamp()));
        Object context = result.metadata().get("context");
        if (context != null) {
            try {
                parts.add("Context: " + MAPPER.writeValueAsString(context));
            } catch (JsonProcessingException e) {
                logger.fine(() -> "Result context not serializable for rule " + rule.id() + ": " + e.getMessage());
            }
        }
        return String.join("\n", parts);
    }

    static List<String> affectedAssets(List<Event> events) {
        Set<String> assets = new LinkedHashSet<>();
        for (Event event : events) {
            if (event.computerName() != null && !event.computerName().isBlank()) {
                assets.add(event.computerName());
            }
            if (event.userName() != null && !event.userName().isBlank()) {
                assets.add("user:" + event.userName());
            }
            if (event.ipAddress() != null && !event.ipAddress().isBlank()) {
                assets.add("ip:" + event.ipAddress());
            }
            event.metadataString("target_host").ifPresent(assets::add);
        }
        return new ArrayList<>(assets);
    }
}
