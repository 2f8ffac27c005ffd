/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Represents an immutable security event delivered to the correlation engine.
 *
 * <p>The engine only ever references events; it never mutates them. The same
 * instance may sit in several buffers and caches at once.
 *
 * @param id           unique identifier of the event
 * @param eventType    event type discriminator (for Windows events, the event id such as "4625")
 * @param source       originating log source ("security", "system", ...)
 * @param severity     declared severity of the event, may be null
 * @param timestamp    time the event occurred
 * @param computerName host that produced the event, may be null
 * @param userName     account associated with the event, may be null
 * @param ipAddress    network address associated with the event, may be null
 * @param metadata     free-form attributes (never null, values may be null)
 */
public record Event(
        @JsonProperty("id") String id,
        @JsonProperty("event_id") String eventType,
        @JsonProperty("source") String source,
        @JsonProperty("severity") String severity,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("computer_name") String computerName,
        @JsonProperty("user_name") String userName,
        @JsonProperty("ip_address") String ipAddress,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public Event {
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Convenience factory for the minimal event shape.
     */
    public static Event of(String id, String eventType, String source, Instant timestamp) {
        return new Event(id, eventType, source, null, timestamp, null, null, null, Map.of());
    }

    /**
     * Returns a metadata attribute rendered as a string, if present.
     */
    public Optional<String> metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
    }

    /**
     * Severity used for index lookups: metadata severity first, then the
     * event's own severity, defaulting to "medium".
     */
    @JsonIgnore
    public String effectiveSeverity() {
        return metadataString("severity")
                .or(() -> Optional.ofNullable(severity))
                .filter(s -> !s.isBlank())
                .orElse("medium");
    }

    /**
     * Whether the producer flagged this event as needing full evaluation.
     */
    @JsonIgnore
    public boolean isComplex() {
        Object flag = metadata.get("complex");
        if (flag instanceof Boolean b) {
            return b;
        }
        return flag != null && Boolean.parseBoolean(String.valueOf(flag));
    }
}
