/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.engine.index;

import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Rule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Immutable rule index for one load generation.
 *
 * <p>Maps index keys to the rules registered under them and carries the
 * membership filter built from the same entries. A reload builds a new
 * instance and swaps it in; readers never see a partially built index.
 *
 * <p>Candidates are returned deduplicated by rule id and in load order
 * (the rule store's priority/severity ordering), which is the order
 * sequential evaluation follows.
 */
public final class RuleIndex {

    private static final Logger logger = Logger.getLogger(RuleIndex.class.getName());

    private static final RuleIndex EMPTY = new RuleIndex(Map.of(), new ExactMembershipFilter(Set.of()), Map.of(), 0);

    private final Map<String, List<Rule>> buckets;
    private final MembershipFilter membership;
    private final Map<String, Integer> loadOrder;
    private final int totalEntries;

    private RuleIndex(Map<String, List<Rule>> buckets, MembershipFilter membership,
                      Map<String, Integer> loadOrder, int totalEntries) {
        this.buckets = buckets;
        this.membership = membership;
        this.loadOrder = loadOrder;
        this.totalEntries = totalEntries;
    }

    public static RuleIndex empty() {
        return EMPTY;
    }

    public static RuleIndex build(List<Rule> rules) {
        return build(rules, ExactMembershipFilter.FACTORY);
    }

    /**
     * Indexes every enabled rule under each of its keys. Later rules with an
     * id already seen are skipped.
     */
    public static RuleIndex build(List<Rule> rules, MembershipFilter.Factory filterFactory) {
        Map<String, List<Rule>> buckets = new HashMap<>();
        Set<MembershipEntry> entries = new HashSet<>();
        Map<String, Integer> loadOrder = new HashMap<>();
        int totalEntries = 0;

        for (Rule rule : rules) {
            if (!rule.enabled()) {
                continue;
            }
            if (loadOrder.putIfAbsent(rule.id(), loadOrder.size()) != null) {
                logger.warning("Duplicate rule id skipped during indexing: " + rule.id());
                continue;
            }
            for (String key : IndexKeys.forRule(rule)) {
                buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(rule);
                entries.add(new MembershipEntry(key, rule.id()));
                totalEntries++;
            }
        }

        Map<String, List<Rule>> frozen = new HashMap<>(buckets.size() * 2);
        buckets.forEach((key, bucket) -> frozen.put(key, List.copyOf(bucket)));

        return new RuleIndex(Map.copyOf(frozen), filterFactory.apply(entries),
                Map.copyOf(loadOrder), totalEntries);
    }

    /**
     * Candidate rules for an event, deduplicated and in load order.
     */
    public List<Rule> candidates(Event event) {
        if (buckets.isEmpty()) {
            return List.of();
        }
        Map<String, Rule> selected = new LinkedHashMap<>();
        for (String key : IndexKeys.forEvent(event)) {
            List<Rule> bucket = buckets.get(key);
            if (bucket == null) {
                continue;
            }
            for (Rule rule : bucket) {
                if (membership.mightContain(key, rule.id())) {
                    selected.putIfAbsent(rule.id(), rule);
                }
            }
        }
        if (selected.size() <= 1) {
            return List.copyOf(selected.values());
        }
        List<Rule> ordered = new ArrayList<>(selected.values());
        ordered.sort(Comparator.comparingInt(rule -> loadOrder.get(rule.id())));
        return ordered;
    }

    public List<Rule> bucket(String indexKey) {
        return buckets.getOrDefault(indexKey, List.of());
    }

    public boolean isRegistered(String indexKey, String ruleId) {
        return membership.mightContain(indexKey, ruleId);
    }

    /**
     * Ids of the indexed rules.
     */
    public Set<String> ruleIds() {
        return loadOrder.keySet();
    }

    public int activeRules() {
        return loadOrder.size();
    }

    public int indexedKeyCount() {
        return buckets.size();
    }

    public int membershipEntryCount() {
        return membership.size();
    }

    public int totalIndexEntries() {
        return totalEntries;
    }

    @Override
    public String toString() {
        return String.format("RuleIndex{rules=%d, keys=%d, entries=%d}",
                activeRules(), indexedKeyCount(), totalIndexEntries());
    }
}
