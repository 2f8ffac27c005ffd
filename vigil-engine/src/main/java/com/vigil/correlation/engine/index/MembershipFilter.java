package com.vigil.correlation.engine.index;

import java.util.Set;
import java.util.function.Function;

/**
 * Fast-reject check consulted before a rule from an index bucket is admitted
 * as a candidate.
 *
 * <p>Implementations must never answer {@code false} for an entry they were
 * built with. The shipped implementation is exact; a probabilistic one could
 * be plugged in through {@link Factory} as long as it keeps that guarantee.
 */
public interface MembershipFilter {

    boolean mightContain(String indexKey, String ruleId);

    int size();

    /**
     * Builds a filter from the complete entry set of one index generation.
     */
    @FunctionalInterface
    interface Factory extends Function<Set<MembershipEntry>, MembershipFilter> {
    }
}
