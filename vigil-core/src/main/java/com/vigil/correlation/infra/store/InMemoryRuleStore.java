/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.infra.store;

import com.vigil.correlation.api.RuleStore;
import com.vigil.correlation.api.model.Rule;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory rule store.
 *
 * <p>Rules are kept in a ConcurrentHashMap keyed by rule id and are lost on
 * restart. Useful for tests and for embedding the engine with rules supplied
 * programmatically.
 *
 * <p><b>Thread Safety:</b> All operations are thread-safe. A load sees a
 * weakly consistent view of concurrent saves.
 */
public class InMemoryRuleStore implements RuleStore {

    private final ConcurrentMap<String, Rule> rules = new ConcurrentHashMap<>();

    public InMemoryRuleStore() {
    }

    public InMemoryRuleStore(Collection<Rule> initialRules) {
        initialRules.forEach(this::save);
    }

    /**
     * Inserts or replaces a rule.
     */
    public void save(Rule rule) {
        rules.put(rule.id(), rule);
    }

    public boolean delete(String ruleId) {
        return rules.remove(ruleId) != null;
    }

    public Optional<Rule> findById(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public int size() {
        return rules.size();
    }

    public void clear() {
        rules.clear();
    }

    @Override
    public List<Rule> loadEnabledRules() {
        return RuleOrdering.enabledInLoadOrder(rules.values());
    }
}
