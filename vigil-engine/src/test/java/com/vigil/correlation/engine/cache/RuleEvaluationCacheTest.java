package com.vigil.correlation.engine.cache;

import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Rule;
import com.vigil.correlation.engine.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RuleEvaluationCacheTest {

    private MutableClock clock;
    private RuleEvaluationCache cache;
    private final Rule rule = Rule.builder("r1").build();

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        cache = new RuleEvaluationCache(Duration.ofSeconds(10), new ClockTicker(clock));
    }

    private Event event(String id, String user) {
        return new Event(id, "4625", "security", null, clock.instant(), null, user, null, null);
    }

    @Test
    void shouldKeyByRuleTypeAndSource() {
        assertThat(RuleEvaluationCache.key(rule, event("e1", "bob"))).isEqualTo("rule:r1:4625:security");
    }

    @Test
    void shouldStoreOnlyMatches() {
        assertThat(cache.putIfMatched(rule, event("e1", null), EvaluationResult.noMatch("r1"))).isFalse();
        assertThat(cache.get(rule, event("e1", null))).isEmpty();

        assertThat(cache.putIfMatched(rule, event("e1", null), EvaluationResult.match("r1", 0.9))).isTrue();
        assertThat(cache.get(rule, event("e2", "other"))).hasValueSatisfying(result -> {
            assertThat(result.matched()).isTrue();
            assertThat(result.confidence()).isEqualTo(0.9);
            assertThat(result.executionTimeMs()).isZero();
        });
    }

    @Test
    void entriesShouldExpireAfterTtl() {
        cache.putIfMatched(rule, event("e1", null), EvaluationResult.match("r1", 1.0));

        clock.advance(Duration.ofSeconds(9));
        assertThat(cache.get(rule, event("e1", null))).isPresent();

        clock.advance(Duration.ofSeconds(2));
        assertThat(cache.get(rule, event("e1", null))).isEmpty();

        cache.sweep();
        assertThat(cache.size()).isZero();
    }

    @Test
    void invalidateAllShouldClear() {
        cache.putIfMatched(rule, event("e1", null), EvaluationResult.match("r1", 1.0));

        cache.invalidateAll();

        assertThat(cache.get(rule, event("e1", null))).isEmpty();
    }
}
