/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.engine.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

/**
 * Per-rule performance counters kept in process.
 *
 * <p>Tracks, for every rule that has been evaluated at least once:
 * evaluation and match counts, evaluation failures, latency (P99, average,
 * max over the last {@value #LATENCY_SAMPLES} samples), and how often
 * handing its matches to the incident manager succeeded or failed.
 *
 * <p>Memory overhead is a few counters plus at most
 * {@value #LATENCY_SAMPLES} latency samples per rule.
 */
public class RuleMetricsAggregator {

    static final int LATENCY_SAMPLES = 1000;

    private final ConcurrentMap<String, LongAdder> evaluationCounts = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> matchCounts = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> errorCounts = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> dispatchSuccesses = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongAdder> dispatchFailures = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LatencyTracker> latencies = new ConcurrentHashMap<>();

    /**
     * Records one completed evaluation.
     *
     * @param ruleId        rule identifier
     * @param matched       whether the rule matched
     * @param durationNanos evaluation duration in nanoseconds
     */
    public void recordEvaluation(String ruleId, boolean matched, long durationNanos) {
        increment(evaluationCounts, ruleId);
        if (matched) {
            increment(matchCounts, ruleId);
        }
        latencies.computeIfAbsent(ruleId, k -> new LatencyTracker()).record(durationNanos);
    }

    public void recordEvaluationError(String ruleId) {
        increment(errorCounts, ruleId);
    }

    /**
     * Records the outcome of handing a match to the incident manager.
     */
    public void recordMatchHandled(String ruleId, boolean success) {
        increment(success ? dispatchSuccesses : dispatchFailures, ruleId);
    }

    private static void increment(ConcurrentMap<String, LongAdder> counters, String ruleId) {
        counters.computeIfAbsent(ruleId, k -> new LongAdder()).increment();
    }

    private static long count(ConcurrentMap<String, LongAdder> counters, String ruleId) {
        LongAdder adder = counters.get(ruleId);
        return adder == null ? 0L : adder.sum();
    }

    /**
     * Top N most frequently evaluated rules, by evaluation count descending.
     */
    public List<HotRule> getHotRules(int topN) {
        return evaluationCounts.entrySet().stream()
                .map(entry -> {
                    String ruleId = entry.getKey();
                    long evaluations = entry.getValue().sum();
                    long matches = count(matchCounts, ruleId);
                    double matchRate = evaluations > 0 ? (double) matches / evaluations : 0.0;
                    return new HotRule(ruleId, evaluations, matches, matchRate);
                })
                .sorted(Comparator.comparingLong(HotRule::evaluationCount).reversed())
                .limit(topN)
                .collect(Collectors.toList());
    }

    /**
     * Rules whose P99 latency is above the threshold, slowest first.
     */
    public List<SlowRule> getSlowRules(long thresholdNanos) {
        return latencies.entrySet().stream()
                .map(entry -> {
                    LatencyTracker tracker = entry.getValue();
                    long p99 = tracker.getP99();
                    if (p99 <= thresholdNanos) {
                        return null;
                    }
                    return new SlowRule(entry.getKey(), p99, tracker.getAvg(), tracker.getMax(),
                            count(evaluationCounts, entry.getKey()));
                })
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingLong(SlowRule::p99Nanos).reversed())
                .collect(Collectors.toList());
    }

    public Optional<RuleStats> getRuleStats(String ruleId) {
        LatencyTracker tracker = latencies.get(ruleId);
        if (tracker == null && !errorCounts.containsKey(ruleId)) {
            return Optional.empty();
        }
        return Optional.of(new RuleStats(
                ruleId,
                count(evaluationCounts, ruleId),
                count(matchCounts, ruleId),
                count(errorCounts, ruleId),
                tracker == null ? 0L : tracker.getP99(),
                tracker == null ? 0L : tracker.getAvg(),
                tracker == null ? 0L : tracker.getMax(),
                count(dispatchSuccesses, ruleId),
                count(dispatchFailures, ruleId)));
    }

    public RuleMetricsSummary getSummary() {
        long totalEvaluations = sum(evaluationCounts);
        long totalMatches = sum(matchCounts);
        double matchRate = totalEvaluations > 0 ? (double) totalMatches / totalEvaluations : 0.0;
        return new RuleMetricsSummary(
                totalEvaluations,
                totalMatches,
                sum(errorCounts),
                matchRate,
                evaluationCounts.size(),
                sum(dispatchSuccesses),
                sum(dispatchFailures));
    }

    private static long sum(ConcurrentMap<String, LongAdder> counters) {
        return counters.values().stream().mapToLong(LongAdder::sum).sum();
    }

    /**
     * Drops the counters of every rule not in {@code activeRuleIds}.
     */
    public void retainRules(Set<String> activeRuleIds) {
        evaluationCounts.keySet().retainAll(activeRuleIds);
        matchCounts.keySet().retainAll(activeRuleIds);
        errorCounts.keySet().retainAll(activeRuleIds);
        dispatchSuccesses.keySet().retainAll(activeRuleIds);
        dispatchFailures.keySet().retainAll(activeRuleIds);
        latencies.keySet().retainAll(activeRuleIds);
    }

    public void reset() {
        evaluationCounts.clear();
        matchCounts.clear();
        errorCounts.clear();
        dispatchSuccesses.clear();
        dispatchFailures.clear();
        latencies.clear();
    }

    /**
     * Latency samples of one rule, bounded to the most recent
     * {@value #LATENCY_SAMPLES}.
     */
    private static class LatencyTracker {
        private final List<Long> samples = new ArrayList<>(LATENCY_SAMPLES);
        private long sum = 0;
        private long max = 0;
        private int count = 0;

        synchronized void record(long nanos) {
            if (samples.size() < LATENCY_SAMPLES) {
                samples.add(nanos);
            } else {
                samples.set(count % LATENCY_SAMPLES, nanos);
            }
            sum += nanos;
            max = Math.max(max, nanos);
            count++;
        }

        synchronized long getP99() {
            if (samples.isEmpty()) return 0;

            List<Long> sorted = new ArrayList<>(samples);
            Collections.sort(sorted);
            int p99Index = (int) Math.ceil(sorted.size() * 0.99) - 1;
            return sorted.get(Math.max(0, p99Index));
        }

        synchronized long getAvg() {
            return count > 0 ? sum / count : 0;
        }

        synchronized long getMax() {
            return max;
        }
    }

    // ===== DTOs =====

    public record HotRule(String ruleId, long evaluationCount, long matchCount, double matchRate) {}

    public record SlowRule(String ruleId, long p99Nanos, long avgNanos, long maxNanos, long evaluationCount) {}

    public record RuleStats(
            String ruleId,
            long evaluations,
            long matches,
            long errors,
            long p99Nanos,
            long avgNanos,
            long maxNanos,
            long matchesHandled,
            long matchHandlingFailures) {}

    public record RuleMetricsSummary(
            long totalEvaluations,
            long totalMatches,
            long totalErrors,
            double overallMatchRate,
            int uniqueRulesEvaluated,
            long matchesHandled,
            long matchHandlingFailures) {}
}
