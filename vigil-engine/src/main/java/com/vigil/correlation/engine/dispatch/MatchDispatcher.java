/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.engine.dispatch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.vigil.correlation.api.ActionExecutor;
import com.vigil.correlation.api.IncidentManager;
import com.vigil.correlation.api.model.EvaluationResult;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.Incident;
import com.vigil.correlation.api.model.PatternMatch;
import com.vigil.correlation.api.model.Rule;
import com.vigil.correlation.engine.metrics.EngineMetrics;
import com.vigil.correlation.engine.metrics.RuleMetricsAggregator;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Hands matches to the incident and action collaborators off the event's
 * processing thread.
 *
 * <p>Submission is bounded: when the dispatch queue is full the match is
 * dropped, counted and logged, never blocking the caller. A rule match
 * either updates the open incident for that rule within the rule's time
 * window or creates a new one; actions then run as a separate task on their
 * own executor. Failures in either step are logged and counted against the
 * rule.
 *
 * <p>On shutdown the match executor drains first; the action executor keeps
 * accepting until then, so every match handled during the drain still has
 * its actions run.
 */
public final class MatchDispatcher {

    private static final Logger logger = Logger.getLogger(MatchDispatcher.class.getName());

    private final IncidentManager incidentManager;
    private final ActionExecutor actionExecutor;
    private final IncidentFactory incidentFactory;
    private final EngineMetrics metrics;
    private final RuleMetricsAggregator ruleMetrics;
    private final ThreadPoolExecutor matchPool;
    private final ThreadPoolExecutor actionPool;

    public MatchDispatcher(IncidentManager incidentManager,
                           ActionExecutor actionExecutor,
                           IncidentFactory incidentFactory,
                           EngineMetrics metrics,
                           RuleMetricsAggregator ruleMetrics,
                           int threads,
                           int queueCapacity) {
        this.incidentManager = incidentManager;
        this.actionExecutor = actionExecutor;
        this.incidentFactory = incidentFactory;
        this.metrics = metrics;
        this.ruleMetrics = ruleMetrics;
        this.matchPool = newPool("match-dispatch-%d", threads, queueCapacity);
        this.actionPool = newPool("match-action-%d", threads, queueCapacity);
    }

    private static ThreadPoolExecutor newPool(String nameFormat, int threads, int queueCapacity) {
        return new ThreadPoolExecutor(
                threads, threads,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new ThreadFactoryBuilder()
                        .setNameFormat(nameFormat)
                        .setDaemon(true)
                        .build(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Schedules incident handling for a rule match.
     *
     * @return false if the match was dropped because the queue is full or
     *         the dispatcher is shut down
     */
    public boolean dispatch(Rule rule, Event event, EvaluationResult result) {
        return submit(matchPool, () -> handleRuleMatch(rule, event, result),
                String.format("rule %s / event %s", rule.id(), event.id()));
    }

    /**
     * Schedules incident creation for a cross-event pattern.
     */
    public boolean dispatchPattern(PatternMatch pattern, Event trigger) {
        return submit(matchPool, () -> handlePattern(pattern, trigger),
                String.format("pattern %s / event %s", pattern.id(), trigger.id()));
    }

    private boolean submit(ThreadPoolExecutor pool, Runnable task, String description) {
        try {
            pool.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            metrics.dispatchRejected();
            logger.warning(String.format("Dispatch queue full or closed, dropping %s", description));
            return false;
        }
    }

    private void handleRuleMatch(Rule rule, Event event, EvaluationResult result) {
        Incident incident;
        try {
            Optional<Incident> open = incidentManager.findOpenIncident(rule.id(), event, rule.timeWindowMinutes());
            if (open.isPresent()) {
                incident = incidentManager.updateIncident(open.get().id(), event, result);
            } else {
                incident = incidentManager.createIncident(incidentFactory.fromRuleMatch(rule, event, result));
            }
            ruleMetrics.recordMatchHandled(rule.id(), true);
        } catch (RuntimeException e) {
            ruleMetrics.recordMatchHandled(rule.id(), false);
            logger.log(Level.WARNING,
                    String.format("Failed to record incident for rule %s, event %s", rule.id(), event.id()), e);
            return;
        }

        if (incident != null) {
            submit(actionPool, () -> runActions(rule, incident, event),
                    String.format("actions for rule %s / incident %s", rule.id(), incident.id()));
        }
    }

    private void runActions(Rule rule, Incident incident, Event event) {
        try {
            actionExecutor.executeActions(rule, incident, event);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING,
                    String.format("Actions failed for rule %s, incident %s", rule.id(), incident.id()), e);
        }
    }

    private void handlePattern(PatternMatch pattern, Event trigger) {
        try {
            Incident incident = incidentManager.createIncident(incidentFactory.fromPattern(pattern, trigger));
            if (incident == null) {
                return;
            }
            for (Event event : pattern.matchedEvents()) {
                Instant timestamp = event.timestamp() != null ? event.timestamp() : trigger.timestamp();
                incidentManager.addCorrelatedEvent(incident.id(), event.id(), timestamp, pattern.relevanceScore());
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING,
                    String.format("Failed to record pattern incident %s for event %s", pattern.id(), trigger.id()), e);
        }
    }

    /**
     * Matches and action tasks waiting to run.
     */
    public int queued() {
        return matchPool.getQueue().size() + actionPool.getQueue().size();
    }

    /**
     * Stops accepting matches, waits for queued matches to be handled, then
     * waits for their actions. Both waits share the timeout.
     *
     * @return true if all queued work finished in time
     */
    public boolean shutdown(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        matchPool.shutdown();
        boolean matchesDrained = drain(matchPool, "match", deadline);
        actionPool.shutdown();
        boolean actionsDrained = drain(actionPool, "action", deadline);
        return matchesDrained && actionsDrained;
    }

    private static boolean drain(ThreadPoolExecutor pool, String kind, long deadline) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            if (pool.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                return true;
            }
            int dropped = pool.shutdownNow().size();
            logger.warning(String.format("Match dispatcher did not drain %s tasks in time, dropped %d",
                    kind, dropped));
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            return false;
        }
    }
}
