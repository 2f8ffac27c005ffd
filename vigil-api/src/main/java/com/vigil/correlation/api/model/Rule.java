/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable correlation rule as loaded from the rule store.
 *
 * <p>Rules are replaced wholesale on every reload; nothing mutates a rule
 * once the index owns it.
 *
 * @param id                stable rule identifier
 * @param name              human readable name, used in incident titles
 * @param description       free text, used in incident descriptions
 * @param priority          higher sorts first
 * @param severity          severity of incidents raised by this rule
 * @param type              rule type ("simple", "threshold", "sequence", ...)
 * @param enabled           disabled rules are never indexed
 * @param conditions        ordered conditions
 * @param timeWindowMinutes window used to find an open incident to update
 * @param metadata          free-form attributes, including {@code category}
 */
public record Rule(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("priority") int priority,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("type") String type,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("conditions") List<RuleCondition> conditions,
        @JsonProperty("time_window_minutes") int timeWindowMinutes,
        @JsonProperty("metadata") Map<String, Object> metadata) {

    public Rule {
        Objects.requireNonNull(id, "Rule id must not be null");
        severity = severity == null ? Severity.MEDIUM : severity;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Rule category from metadata, or null when none is set.
     */
    @JsonIgnore
    public String category() {
        Object category = metadata.get("category");
        return category == null ? null : String.valueOf(category);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private int priority;
        private Severity severity = Severity.MEDIUM;
        private String type = "simple";
        private boolean enabled = true;
        private List<RuleCondition> conditions = List.of();
        private int timeWindowMinutes = 60;
        private Map<String, Object> metadata = Map.of();

        private Builder(String id) {
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder priority(int priority) { this.priority = priority; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder type(String type) { this.type = type; return this; }
        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }
        public Builder conditions(List<RuleCondition> conditions) { this.conditions = conditions; return this; }
        public Builder condition(RuleCondition condition) {
            List<RuleCondition> copy = new ArrayList<>(conditions);
            copy.add(condition);
            this.conditions = copy;
            return this;
        }
        public Builder timeWindowMinutes(int minutes) { this.timeWindowMinutes = minutes; return this; }
        public Builder metadata(Map<String, Object> metadata) { this.metadata = metadata; return this; }

        public Rule build() {
            return new Rule(id, name, description, priority, severity, type, enabled,
                    conditions, timeWindowMinutes, metadata);
        }
    }
}
