package com.vigil.correlation.engine.index;

import java.util.Set;

/**
 * Hash-set membership filter. No false positives, no false negatives.
 */
public final class ExactMembershipFilter implements MembershipFilter {

    public static final MembershipFilter.Factory FACTORY = ExactMembershipFilter::new;

    private final Set<MembershipEntry> entries;

    public ExactMembershipFilter(Set<MembershipEntry> entries) {
        this.entries = Set.copyOf(entries);
    }

    @Override
    public boolean mightContain(String indexKey, String ruleId) {
        return entries.contains(new MembershipEntry(indexKey, ruleId));
    }

    @Override
    public int size() {
        return entries.size();
    }
}
