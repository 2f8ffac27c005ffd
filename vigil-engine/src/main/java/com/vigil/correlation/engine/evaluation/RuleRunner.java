package com.vigil.correlation.engine.evaluation;

import com.vigil.correlation.api.RuleEvaluator;
import com.vigil.correlation.api.model.CorrelationContext;
import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Rule;
import com.vigil.correlation.engine.cache.RuleEvaluationCache;
import com.vigil.correlation.engine.metrics.EngineMetrics;
import com.vigil.correlation.engine.metrics.RuleMetricsAggregator;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates one rule against one event, isolated from every other rule.
 *
 * <p>Consults the rule evaluation cache first. A failing evaluator is
 * logged with the rule and event ids and reported as an empty result; it
 * never propagates.
 */
public final class RuleRunner {

    private static final Logger logger = Logger.getLogger(RuleRunner.class.getName());

    private final RuleEvaluator evaluator;
    private final RuleEvaluationCache cache;
    private final EngineMetrics metrics;
    private final RuleMetricsAggregator ruleMetrics;

    public RuleRunner(RuleEvaluator evaluator, RuleEvaluationCache cache,
                      EngineMetrics metrics, RuleMetricsAggregator ruleMetrics) {
        this.evaluator = evaluator;
        this.cache = cache;
        this.metrics = metrics;
        this.ruleMetrics = ruleMetrics;
    }

    /**
     * @return the verdict, or empty if the evaluator threw
     */
    public Optional<EvaluationResult> run(Rule rule, Event event, CorrelationContext context) {
        Optional<EvaluationResult> cached = cache.get(rule, event);
        if (cached.isPresent()) {
            metrics.cacheHit(EngineMetrics.CACHE_RULE);
            return cached;
        }
        metrics.cacheMiss(EngineMetrics.CACHE_RULE);

        long start = System.nanoTime();
        try {
            EvaluationResult result = evaluator.evaluate(rule, event, context);
            long elapsed = System.nanoTime() - start;
            if (result == null) {
                result = EvaluationResult.noMatch(rule.id());
            }
            result = result.withExecutionTime(TimeUnit.NANOSECONDS.toMillis(elapsed));

            metrics.ruleEvaluated();
            ruleMetrics.recordEvaluation(rule.id(), result.matched(), elapsed);
            cache.putIfMatched(rule, event, result);
            return Optional.of(result);
        } catch (RuntimeException e) {
            metrics.evaluationFailed();
            ruleMetrics.recordEvaluationError(rule.id());
            logger.log(Level.WARNING,
                    String.format("Rule %s failed to evaluate event %s", rule.id(), event.id()), e);
            return Optional.empty();
        }
    }
}
