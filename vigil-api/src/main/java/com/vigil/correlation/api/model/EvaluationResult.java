package com.vigil.correlation.api.model;

import java.util.List;
import java.util.Map;

/**
 * Verdict of a single (rule, event) evaluation.
 *
 * @param ruleId            rule that was evaluated
 * @param matched           whether the rule matched
 * @param confidence        evaluator confidence in [0, 1]
 * @param executionTimeMs   time spent evaluating (0 when served from cache)
 * @param matchedConditions ids or descriptions of the conditions that held
 * @param metadata          evaluator context carried into the incident
 */
public record EvaluationResult(
        String ruleId,
        boolean matched,
        double confidence,
        long executionTimeMs,
        List<String> matchedConditions,
        Map<String, Object> metadata) {

    public EvaluationResult {
        matchedConditions = matchedConditions == null ? List.of() : List.copyOf(matchedConditions);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static EvaluationResult noMatch(String ruleId) {
        return new EvaluationResult(ruleId, false, 0.0, 0L, List.of(), Map.of());
    }

    public static EvaluationResult match(String ruleId, double confidence) {
        return new EvaluationResult(ruleId, true, confidence, 0L, List.of(), Map.of());
    }

    public EvaluationResult withExecutionTime(long millis) {
        return new EvaluationResult(ruleId, matched, confidence, millis, matchedConditions, metadata);
    }
}
