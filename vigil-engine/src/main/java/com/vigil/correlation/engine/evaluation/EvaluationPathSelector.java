/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.engine.evaluation;

import com.vigil.correlation.api.model.CorrelationContext;
import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Rule;
import com.vigil.correlation.api.model.RuntimeConfig;
import com.vigil.correlation.engine.cache.FastPathCache;
import com.vigil.correlation.engine.index.RuleIndexManager;
import com.vigil.correlation.engine.metrics.EngineMetrics;
import com.vigil.correlation.infra.config.EngineConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chooses how an event's candidate rules are evaluated, and evaluates them.
 *
 * <h2>Paths</h2>
 * <ul>
 *   <li><b>Fast</b>: common event type from a trusted source, not flagged
 *       complex, with few candidates. Only the top N candidates run, in
 *       parallel, and an "already handled" marker suppresses repeats until
 *       it expires.</li>
 *   <li><b>Standard parallel</b>: candidates run in fixed-size chunks, each
 *       chunk concurrently, one chunk at a time. Chosen when parallel
 *       evaluation is on, there are more candidates than one chunk, and the
 *       normal lane is not saturated.</li>
 *   <li><b>Standard sequential</b>: the first candidates up to a cap, in
 *       order.</li>
 *   <li><b>Stream</b>: all candidates in chunks of the stream concurrency.</li>
 * </ul>
 * Results are always returned in candidate order. A rule that throws is
 * left out of the matches and flags the outcome as {@code anyFailed}.
 */
public final class EvaluationPathSelector {

    private static final Logger logger = Logger.getLogger(EvaluationPathSelector.class.getName());

    static final Set<String> FAST_PATH_EVENT_TYPES = Set.of("4624", "4625", "4648", "4776", "4778");
    static final Set<String> FAST_PATH_SOURCES = Set.of("security", "system");

    private final RuleIndexManager indexManager;
    private final FastPathCache fastPathCache;
    private final RuleRunner runner;
    private final Executor evaluationExecutor;
    private final EngineMetrics metrics;
    private final EngineConfig config;
    private final IntSupplier normalQueueDepth;

    public EvaluationPathSelector(RuleIndexManager indexManager,
                                  FastPathCache fastPathCache,
                                  RuleRunner runner,
                                  Executor evaluationExecutor,
                                  EngineMetrics metrics,
                                  EngineConfig config,
                                  IntSupplier normalQueueDepth) {
        this.indexManager = indexManager;
        this.fastPathCache = fastPathCache;
        this.runner = runner;
        this.evaluationExecutor = evaluationExecutor;
        this.metrics = metrics;
        this.config = config;
        this.normalQueueDepth = normalQueueDepth;
    }

    /**
     * Real-time evaluation: fast path when eligible, standard path otherwise.
     */
    public EvaluationOutcome evaluate(Event event, RuntimeConfig runtime) {
        List<Rule> candidates = indexManager.current().candidates(event);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Event %s has %d candidate rules", event.id(), candidates.size()));
        }
        CorrelationContext context = CorrelationContext.of(event);
        if (isFastPathEligible(event, candidates.size(), runtime)) {
            return fastPath(event, context, candidates);
        }
        return standardPath(event, context, candidates, runtime);
    }

    /**
     * Stream evaluation: every candidate, {@code streamConcurrency} at a time.
     */
    public EvaluationOutcome evaluateStream(Event event) {
        List<Rule> candidates = indexManager.current().candidates(event);
        CorrelationContext context = CorrelationContext.of(event);
        return evaluateChunked(EvaluationPath.STREAM, event, context, candidates, config.streamConcurrency());
    }

    boolean isFastPathEligible(Event event, int candidateCount, RuntimeConfig runtime) {
        if (!runtime.fastPathEnabled()) {
            return false;
        }
        if (event.eventType() == null || !FAST_PATH_EVENT_TYPES.contains(event.eventType())) {
            return false;
        }
        if (event.source() == null || !FAST_PATH_SOURCES.contains(event.source().toLowerCase(Locale.ROOT))) {
            return false;
        }
        return !event.isComplex() && candidateCount <= config.fastPathMaxCandidates();
    }

    private EvaluationOutcome fastPath(Event event, CorrelationContext context, List<Rule> candidates) {
        if (fastPathCache.isHandled(event)) {
            metrics.cacheHit(EngineMetrics.CACHE_FAST_PATH);
            return new EvaluationOutcome(EvaluationPath.FAST_CACHED, List.of(), candidates.size(), false);
        }
        metrics.cacheMiss(EngineMetrics.CACHE_FAST_PATH);

        List<Rule> top = candidates.subList(0, Math.min(config.fastPathTopN(), candidates.size()));
        EvaluationOutcome outcome = evaluateChunk(EvaluationPath.FAST, event, context, top, candidates.size());
        if (!outcome.anyFailed()) {
            fastPathCache.markHandled(event);
        }
        return outcome;
    }

    private EvaluationOutcome standardPath(Event event, CorrelationContext context,
                                           List<Rule> candidates, RuntimeConfig runtime) {
        int chunkSize = config.parallelChunkSize();
        boolean parallel = runtime.parallelRuleEvaluation()
                && candidates.size() > chunkSize
                && normalQueueDepth.getAsInt() < config.parallelQueueThreshold();
        if (parallel) {
            return evaluateChunked(EvaluationPath.STANDARD_PARALLEL, event, context, candidates, chunkSize);
        }

        List<Rule> capped = candidates.subList(0, Math.min(config.sequentialCap(), candidates.size()));
        List<Match> matches = new ArrayList<>();
        boolean anyFailed = false;
        for (Rule rule : capped) {
            Optional<EvaluationResult> result = runner.run(rule, event, context);
            if (result.isEmpty()) {
                anyFailed = true;
            } else if (result.get().matched()) {
                matches.add(new Match(rule, result.get()));
            }
        }
        return new EvaluationOutcome(EvaluationPath.STANDARD_SEQUENTIAL, matches, candidates.size(), anyFailed);
    }

    private EvaluationOutcome evaluateChunked(EvaluationPath path, Event event, CorrelationContext context,
                                              List<Rule> candidates, int chunkSize) {
        List<Match> matches = new ArrayList<>();
        boolean anyFailed = false;
        for (int from = 0; from < candidates.size(); from += chunkSize) {
            List<Rule> chunk = candidates.subList(from, Math.min(from + chunkSize, candidates.size()));
            EvaluationOutcome partial = evaluateChunk(path, event, context, chunk, candidates.size());
            matches.addAll(partial.matches());
            anyFailed |= partial.anyFailed();
        }
        return new EvaluationOutcome(path, matches, candidates.size(), anyFailed);
    }

    /**
     * Runs one chunk concurrently and waits for all of it.
     */
    private EvaluationOutcome evaluateChunk(EvaluationPath path, Event event, CorrelationContext context,
                                            List<Rule> chunk, int candidateCount) {
        List<CompletableFuture<Optional<EvaluationResult>>> futures = new ArrayList<>(chunk.size());
        for (Rule rule : chunk) {
            futures.add(submit(rule, event, context));
        }

        List<Match> matches = new ArrayList<>();
        boolean anyFailed = false;
        for (int i = 0; i < chunk.size(); i++) {
            Optional<EvaluationResult> result = futures.get(i).join();
            if (result.isEmpty()) {
                anyFailed = true;
            } else if (result.get().matched()) {
                matches.add(new Match(chunk.get(i), result.get()));
            }
        }
        return new EvaluationOutcome(path, matches, candidateCount, anyFailed);
    }

    private CompletableFuture<Optional<EvaluationResult>> submit(Rule rule, Event event,
                                                                 CorrelationContext context) {
        try {
            return CompletableFuture.supplyAsync(() -> runner.run(rule, event, context), evaluationExecutor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(runner.run(rule, event, context));
        }
    }
}
