package com.vigil.correlation.api;

import com.vigil.correlation.api.exceptions.RuleLoadException;
import com.vigil.correlation.api.model.Rule;

import java.util.List;

/**
 * Source of correlation rules.
 */
public interface RuleStore {

    /**
     * Loads every enabled rule with its conditions, ordered by priority
     * descending and then severity descending.
     *
     * @throws RuleLoadException if the backing store cannot be read
     */
    List<Rule> loadEnabledRules() throws RuleLoadException;
}
