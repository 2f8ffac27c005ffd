package com.vigil.correlation.infra.store;

import com.vigil.correlation.api.model.Rule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Load order shared by the rule stores: priority descending, then severity
 * descending, then id for a stable tie-break.
 */
public final class RuleOrdering {

    public static final Comparator<Rule> LOAD_ORDER = Comparator
            .comparingInt(Rule::priority).reversed()
            .thenComparing(Rule::severity, Comparator.reverseOrder())
            .thenComparing(Rule::id);

    private RuleOrdering() {
        throw new AssertionError("No instances");
    }

    /**
     * Enabled rules only, in {@link #LOAD_ORDER}.
     */
    public static List<Rule> enabledInLoadOrder(Iterable<Rule> rules) {
        ArrayList<Rule> enabled = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.enabled()) {
                enabled.add(rule);
            }
        }
        enabled.sort(LOAD_ORDER);
        return List.copyOf(enabled);
    }
}
