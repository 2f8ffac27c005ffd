package com.vigil.correlation.engine.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Rule;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived memo of matching evaluation results, keyed by
 * {@code rule:<ruleId>:<eventType>:<source>}.
 *
 * <p>Only matches are stored. A hit is returned with an execution time of
 * zero. Size is bounded only by expiry; {@link #sweep()} removes expired
 * entries eagerly.
 */
public final class RuleEvaluationCache {

    private final Cache<String, EvaluationResult> cache;

    public RuleEvaluationCache(Duration ttl, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    public static String key(Rule rule, Event event) {
        return "rule:" + rule.id() + ":" + event.eventType() + ":" + event.source();
    }

    public Optional<EvaluationResult> get(Rule rule, Event event) {
        EvaluationResult cached = cache.getIfPresent(key(rule, event));
        return cached == null ? Optional.empty() : Optional.of(cached.withExecutionTime(0));
    }

    /**
     * Stores the result if it matched. Returns whether it was stored.
     */
    public boolean putIfMatched(Rule rule, Event event, EvaluationResult result) {
        if (result == null || !result.matched()) {
            return false;
        }
        cache.put(key(rule, event), result);
        return true;
    }

    public void sweep() {
        cache.cleanUp();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
