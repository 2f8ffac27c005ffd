package com.vigil.correlation.engine.evaluation;

import com.vigil.correlation.api.RuleEvaluator;
import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Rule;
import com.vigil.correlation.api.model.RuleCondition;
import com.vigil.correlation.api.model.RuntimeConfig;
import com.vigil.correlation.api.model.RuntimeConfigPatch;
import com.vigil.correlation.engine.MutableClock;
import com.vigil.correlation.engine.cache.ClockTicker;
import com.vigil.correlation.engine.cache.FastPathCache;
import com.vigil.correlation.engine.cache.RuleEvaluationCache;
import com.vigil.correlation.engine.index.RuleIndexManager;
import com.vigil.correlation.engine.metrics.EngineMetrics;
import com.vigil.correlation.engine.metrics.RuleMetricsAggregator;
import com.vigil.correlation.infra.config.EngineConfig;
import com.vigil.correlation.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.vigil.correlation.infra.store.InMemoryRuleStore;
import com.vigil.correlation.infra.tracing.TracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluationPathSelectorTest {

    private MutableClock clock;
    private InMemoryRuleStore store;
    private RuleIndexManager indexManager;
    private InMemoryMetricsRegistry registry;
    private EngineMetrics metrics;
    private ExecutorService executor;
    private List<String> evaluated;
    private AtomicInteger normalQueueDepth;
    private RuleEvaluator evaluator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-01T10:00:00Z");
        store = new InMemoryRuleStore();
        indexManager = new RuleIndexManager(store, TracingService.noop().getTracer());
        registry = new InMemoryMetricsRegistry();
        metrics = new EngineMetrics(registry);
        executor = Executors.newFixedThreadPool(4);
        evaluated = Collections.synchronizedList(new ArrayList<>());
        normalQueueDepth = new AtomicInteger();
        evaluator = (rule, event, context) -> {
            evaluated.add(rule.id());
            if (rule.id().startsWith("boom")) {
                throw new IllegalStateException("evaluator failure");
            }
            return rule.id().startsWith("hit") ? EvaluationResult.match(rule.id(), 0.8) : EvaluationResult.noMatch(rule.id());
        };
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private EvaluationPathSelector selector(EngineConfig config) {
        RuleRunner runner = new RuleRunner(
                (rule, event, context) -> evaluator.evaluate(rule, event, context),
                new RuleEvaluationCache(config.ruleCacheTtl(), new ClockTicker(clock)),
                metrics, new RuleMetricsAggregator());
        FastPathCache fastPathCache = new FastPathCache(() -> 30_000L, new ClockTicker(clock));
        return new EvaluationPathSelector(indexManager, fastPathCache, runner, executor, metrics, config,
                normalQueueDepth::get);
    }

    private void load(int count, String prefix, String eventId) throws Exception {
        for (int i = 0; i < count; i++) {
            store.save(Rule.builder(String.format("%s-%02d", prefix, i))
                    .priority(100 - i)
                    .condition(RuleCondition.equalsCondition("event_id", eventId))
                    .build());
        }
        indexManager.reload();
    }

    private Event event(String type, String source) {
        return new Event("e-1", type, source, null, clock.instant(), "host", "alice", null, null);
    }

    @Test
    void commonSecurityEventWithFewCandidatesShouldTakeFastPath() throws Exception {
        load(4, "hit", "4625");
        EvaluationPathSelector selector = selector(EngineConfig.defaults());

        EvaluationOutcome outcome = selector.evaluate(event("4625", "security"), RuntimeConfig.defaults());

        assertThat(outcome.path()).isEqualTo(EvaluationPath.FAST);
        assertThat(outcome.candidateCount()).isEqualTo(4);
        assertThat(outcome.matches()).extracting(m -> m.rule().id()).containsExactly("hit-00", "hit-01", "hit-02");
        assertThat(evaluated).hasSize(3);
    }

    @Test
    void repeatedFastPathEventShouldBeServedFromMarker() throws Exception {
        load(2, "hit", "4625");
        EvaluationPathSelector selector = selector(EngineConfig.defaults());

        selector.evaluate(event("4625", "security"), RuntimeConfig.defaults());
        evaluated.clear();
        EvaluationOutcome second = selector.evaluate(event("4625", "security"), RuntimeConfig.defaults());

        assertThat(second.path()).isEqualTo(EvaluationPath.FAST_CACHED);
        assertThat(second.matches()).isEmpty();
        assertThat(evaluated).isEmpty();
        assertThat(registry.getCounterValue(EngineMetrics.CACHE_HITS, "cache", EngineMetrics.CACHE_FAST_PATH))
                .isEqualTo(1);
    }

    @Test
    void failedFastPathEvaluationShouldNotWriteMarker() throws Exception {
        load(1, "boom", "4625");
        EvaluationPathSelector selector = selector(EngineConfig.defaults());

        EvaluationOutcome first = selector.evaluate(event("4625", "security"), RuntimeConfig.defaults());
        EvaluationOutcome second = selector.evaluate(event("4625", "security"), RuntimeConfig.defaults());

        assertThat(first.anyFailed()).isTrue();
        assertThat(second.path()).isEqualTo(EvaluationPath.FAST);
        assertThat(evaluated).hasSize(2);
    }

    @Test
    void complexEventsAndDisabledFastPathShouldUseStandardPath() throws Exception {
        load(2, "hit", "4625");
        EvaluationPathSelector selector = selector(EngineConfig.defaults());
        Event complex = new Event("e-2", "4625", "security", null, clock.instant(), null, null, null,
                Map.of("complex", true));
        RuntimeConfig noFastPath = RuntimeConfig.defaults()
                .merge(RuntimeConfigPatch.builder().fastPathEnabled(false).build());

        assertThat(selector.evaluate(complex, RuntimeConfig.defaults()).path())
                .isEqualTo(EvaluationPath.STANDARD_SEQUENTIAL);
        assertThat(selector.evaluate(event("4625", "security"), noFastPath).path())
                .isEqualTo(EvaluationPath.STANDARD_SEQUENTIAL);
    }

    @Test
    void manyCandidatesShouldBeEvaluatedInParallelChunks() throws Exception {
        load(12, "hit", "7045");
        EvaluationPathSelector selector = selector(EngineConfig.defaults());

        EvaluationOutcome outcome = selector.evaluate(event("7045", "application"), RuntimeConfig.defaults());

        assertThat(outcome.path()).isEqualTo(EvaluationPath.STANDARD_PARALLEL);
        assertThat(outcome.matches()).hasSize(12);
        assertThat(outcome.matches().get(0).rule().id()).isEqualTo("hit-00");
        assertThat(outcome.matches().get(11).rule().id()).isEqualTo("hit-11");
    }

    @Test
    void saturatedNormalQueueShouldForceSequentialWithCap() throws Exception {
        load(25, "miss", "7045");
        normalQueueDepth.set(100);
        EvaluationPathSelector selector = selector(EngineConfig.defaults());

        EvaluationOutcome outcome = selector.evaluate(event("7045", "application"), RuntimeConfig.defaults());

        assertThat(outcome.path()).isEqualTo(EvaluationPath.STANDARD_SEQUENTIAL);
        assertThat(outcome.candidateCount()).isEqualTo(25);
        assertThat(evaluated).hasSize(20).startsWith("miss-00", "miss-01");
    }

    @Test
    void failingRuleShouldNotAbortOtherRules() throws Exception {
        store.save(Rule.builder("boom").priority(10).build());
        store.save(Rule.builder("hit").priority(5).build());
        indexManager.reload();
        EvaluationPathSelector selector = selector(EngineConfig.defaults());

        EvaluationOutcome outcome = selector.evaluate(event("7045", "application"), RuntimeConfig.defaults());

        assertThat(outcome.anyFailed()).isTrue();
        assertThat(outcome.matches()).extracting(m -> m.rule().id()).containsExactly("hit");
        assertThat(metrics.evaluationErrors()).isEqualTo(1);
    }

    @Test
    void cachedMatchShouldNotInvokeEvaluatorAgain() throws Exception {
        load(1, "hit", "7045");
        EvaluationPathSelector selector = selector(EngineConfig.defaults());

        selector.evaluate(event("7045", "application"), RuntimeConfig.defaults());
        EvaluationOutcome second = selector.evaluate(event("7045", "application"), RuntimeConfig.defaults());

        assertThat(evaluated).containsExactly("hit-00");
        assertThat(second.matches()).singleElement()
                .satisfies(m -> assertThat(m.result().executionTimeMs()).isZero());
    }

    @Test
    void streamPathShouldEvaluateEveryCandidate() throws Exception {
        load(23, "hit", "4625");
        EngineConfig config = EngineConfig.builder().streamConcurrency(10).build();
        EvaluationPathSelector selector = selector(config);

        EvaluationOutcome outcome = selector.evaluateStream(event("4625", "security"));

        assertThat(outcome.path()).isEqualTo(EvaluationPath.STREAM);
        assertThat(outcome.matches()).hasSize(23);
        assertThat(evaluated).hasSize(23);
    }

    @Test
    void eventWithNoCandidatesShouldNotCallEvaluator() throws Exception {
        load(3, "hit", "4625");
        EvaluationPathSelector selector = selector(EngineConfig.defaults());

        EvaluationOutcome outcome = selector.evaluate(event("7045", "application"), RuntimeConfig.defaults());

        assertThat(outcome.candidateCount()).isZero();
        assertThat(evaluated).isEmpty();
    }

    @Test
    void nullResultShouldCountAsNoMatch() throws Exception {
        load(1, "hit", "7045");
        evaluator = (rule, event, context) -> null;
        EvaluationPathSelector selector = selector(EngineConfig.defaults());

        EvaluationOutcome outcome = selector.evaluate(event("7045", "application"), RuntimeConfig.defaults());

        assertThat(outcome.matches()).isEmpty();
        assertThat(outcome.anyFailed()).isFalse();
        assertThat(metrics.ruleEvaluations()).isEqualTo(1);
    }

    @Test
    void cacheMissesShouldBeCountedPerCache() throws Exception {
        load(1, "hit", "7045");
        EvaluationPathSelector selector = selector(EngineConfig.defaults());

        selector.evaluate(event("7045", "application"), RuntimeConfig.defaults());

        assertThat(registry.getCounterValue(EngineMetrics.CACHE_MISSES, "cache", EngineMetrics.CACHE_RULE))
                .isEqualTo(1);
        assertThat(metrics.cacheMisses()).isEqualTo(1);
    }
}
