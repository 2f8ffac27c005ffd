package com.vigil.correlation.engine.index;

import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Rule;
import com.vigil.correlation.api.model.RuleCondition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Derives index keys for rules and events.
 *
 * <p>A rule is keyed by each equality condition on one of the discriminator
 * fields ({@code event_id}, {@code source}, {@code severity},
 * {@code category}, {@code type}) as {@code field:value}. A rule with no such
 * condition is keyed by {@link #WILDCARD} and is a candidate for every event.
 *
 * <p>An event produces the same key shapes from its own attributes plus the
 * wildcard, so a rule keyed by {@code event_id:4625} is found by any event of
 * type 4625. Values are compared exactly.
 */
public final class IndexKeys {

    public static final String WILDCARD = "*";

    public static final String EVENT_ID = "event_id";
    public static final String SOURCE = "source";
    public static final String SEVERITY = "severity";
    public static final String CATEGORY = "category";
    public static final String TYPE = "type";

    private static final Set<String> DISCRIMINATORS = Set.of(EVENT_ID, SOURCE, SEVERITY, CATEGORY, TYPE);

    private IndexKeys() {
        throw new AssertionError("No instances");
    }

    public static String key(String field, String value) {
        return field + ":" + value;
    }

    /**
     * Keys a rule registers under, in condition order. Never empty.
     */
    public static Set<String> forRule(Rule rule) {
        Set<String> keys = new LinkedHashSet<>();
        for (RuleCondition condition : rule.conditions()) {
            if (!condition.isEquality() || condition.fieldName() == null || condition.value() == null) {
                continue;
            }
            String field = condition.fieldName().toLowerCase(Locale.ROOT);
            if (DISCRIMINATORS.contains(field)) {
                keys.add(key(field, condition.value()));
            }
        }
        if (keys.isEmpty()) {
            keys.add(WILDCARD);
        }
        return Collections.unmodifiableSet(keys);
    }

    /**
     * Lookup keys for an event. Severity falls back to "medium"; category and
     * type are taken from metadata when present; the wildcard is always last.
     */
    public static List<String> forEvent(Event event) {
        List<String> keys = new ArrayList<>(6);
        keys.add(key(EVENT_ID, event.eventType()));
        keys.add(key(SOURCE, event.source()));
        keys.add(key(SEVERITY, event.effectiveSeverity()));
        event.metadataString(CATEGORY).ifPresent(v -> keys.add(key(CATEGORY, v)));
        event.metadataString(TYPE).ifPresent(v -> keys.add(key(TYPE, v)));
        keys.add(WILDCARD);
        return keys;
    }
}
