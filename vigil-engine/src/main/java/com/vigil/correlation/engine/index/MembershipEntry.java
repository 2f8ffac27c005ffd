package com.vigil.correlation.engine.index;

/**
 * Records that a rule is registered under an index key.
 */
public record MembershipEntry(String indexKey, String ruleId) {
}
