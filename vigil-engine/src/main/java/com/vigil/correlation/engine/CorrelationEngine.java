/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.engine;

import com.google.common.util.concurrent.RateLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.vigil.correlation.api.ActionExecutor;
import com.vigil.correlation.api.EventBufferView;
import com.vigil.correlation.api.ICorrelationEngine;
import com.vigil.correlation.api.IncidentManager;
import com.vigil.correlation.api.PatternMatcher;
import com.vigil.correlation.api.RuleEvaluator;
import com.vigil.correlation.api.RuleStore;
import com.vigil.correlation.api.exceptions.RuleLoadException;
import com.vigil.correlation.api.model.EngineStats;
import com.vigil.correlation.api.model.Event;
import com.vigil.correlation.api.model.EventPriority;
import com.vigil.correlation.api.model.PatternMatch;
import com.vigil.correlation.api.model.ProcessingOutcome;
import com.vigil.correlation.api.model.ProcessingOutcome.Disposition;
import com.vigil.correlation.api.model.RuntimeConfig;
import com.vigil.correlation.api.model.RuntimeConfigPatch;
import com.vigil.correlation.engine.admission.AdmissionController;
import com.vigil.correlation.engine.admission.CircuitBreaker;
import com.vigil.correlation.engine.batch.BatchAggregator;
import com.vigil.correlation.engine.buffer.EventBufferStore;
import com.vigil.correlation.engine.cache.ClockTicker;
import com.vigil.correlation.engine.cache.FastPathCache;
import com.vigil.correlation.engine.cache.RuleEvaluationCache;
import com.vigil.correlation.engine.config.RuntimeSettings;
import com.vigil.correlation.engine.dispatch.IncidentFactory;
import com.vigil.correlation.engine.dispatch.MatchDispatcher;
import com.vigil.correlation.engine.evaluation.EvaluationOutcome;
import com.vigil.correlation.engine.evaluation.EvaluationPath;
import com.vigil.correlation.engine.evaluation.EvaluationPathSelector;
import com.vigil.correlation.engine.evaluation.Match;
import com.vigil.correlation.engine.evaluation.RuleRunner;
import com.vigil.correlation.engine.index.RuleIndex;
import com.vigil.correlation.engine.index.RuleIndexManager;
import com.vigil.correlation.engine.metrics.EngineMetrics;
import com.vigil.correlation.engine.metrics.RuleMetricsAggregator;
import com.vigil.correlation.engine.routing.PriorityClassifier;
import com.vigil.correlation.engine.routing.WorkerPool;
import com.vigil.correlation.engine.tuning.AdaptiveTuner;
import com.vigil.correlation.engine.tuning.PerformanceWindow;
import com.vigil.correlation.infra.config.EngineConfig;
import com.vigil.correlation.infra.metrics.MetricsRegistry;
import com.vigil.correlation.infra.tracing.TracingService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Real-time correlation engine.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Admission: reject when the circuit breaker is open or too many
 *       events are in flight</li>
 *   <li>Mode: stream (inline), batch (aggregated) or real-time (priority
 *       lanes), read fresh from the runtime configuration per event</li>
 *   <li>Evaluation: candidate rules from the index, evaluated on the fast,
 *       standard or stream path</li>
 *   <li>Dispatch: matches handed to the incident manager without waiting</li>
 * </ol>
 *
 * <p>Every component is owned by the instance, so several engines can run
 * side by side in one JVM.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CorrelationEngine engine = CorrelationEngine.builder()
 *         .ruleStore(store)
 *         .ruleEvaluator(evaluator)
 *         .incidentManager(incidents)
 *         .build();
 * engine.initialize();
 * ProcessingOutcome outcome = engine.processEvent(event);
 * }</pre>
 */
public final class CorrelationEngine implements ICorrelationEngine {

    private static final Logger logger = Logger.getLogger(CorrelationEngine.class.getName());

    static final List<String> WARMUP_EVENT_TYPES = List.of("4624", "4625", "4648", "4778");
    static final List<String> WARMUP_SOURCES = List.of("security", "system");

    static final String DROP_SHUTDOWN = "shutdown";
    static final String DROP_INVALID = "invalid";
    static final String DROP_CIRCUIT_OPEN = "circuit_open";
    static final String DROP_OVERLOAD = "overload";

    public enum State {
        NEW,
        RUNNING,
        SHUTTING_DOWN,
        TERMINATED
    }

    private final RuleStore ruleStore;
    private final RuleEvaluator ruleEvaluator;
    private final PatternMatcher patternMatcher;
    private final IncidentManager incidentManager;
    private final ActionExecutor actionExecutor;
    private final EngineConfig config;
    private final Clock clock;
    private final Tracer tracer;

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private final RuntimeSettings settings;
    private final EngineMetrics metrics;
    private final RuleMetricsAggregator ruleMetrics;
    private final CircuitBreaker circuitBreaker;
    private final AdmissionController admission;
    private final PriorityClassifier classifier;
    private final WorkerPool highPriorityPool;
    private final WorkerPool normalPriorityPool;
    private final RuleIndexManager indexManager;
    private final RuleEvaluationCache ruleCache;
    private final FastPathCache fastPathCache;
    private final ExecutorService evaluationExecutor;
    private final EvaluationPathSelector pathSelector;
    private final EventBufferStore eventBuffers;
    private final PerformanceWindow performanceWindow;
    private final AdaptiveTuner tuner;
    private final MatchDispatcher dispatcher;
    private final ExecutorService batchWorkers;
    private final BatchAggregator batchAggregator;
    private final ScheduledExecutorService maintenance;
    private final RateLimiter dropWarningLimiter = RateLimiter.create(1.0);

    private volatile int lastBatchSize;
    private volatile long lastBatchProcessingMs;
    private volatile double lastBatchThroughput;
    private final AtomicLong batchesFlushed = new AtomicLong();

    private CorrelationEngine(Builder builder) {
        this.ruleStore = builder.ruleStore;
        this.ruleEvaluator = builder.ruleEvaluator;
        this.patternMatcher = builder.patternMatcher;
        this.incidentManager = builder.incidentManager;
        this.actionExecutor = builder.actionExecutor;
        this.config = builder.config;
        this.clock = builder.clock;
        this.tracer = builder.tracer;

        this.settings = new RuntimeSettings(config.initialRuntime());
        this.metrics = new EngineMetrics(builder.metrics);
        this.ruleMetrics = new RuleMetricsAggregator();

        this.circuitBreaker = new CircuitBreaker(config.circuitBreakerThreshold(),
                config.circuitBreakerTimeout(), clock);
        this.highPriorityPool = new WorkerPool("correlation-high", config.highPriorityPool());
        this.normalPriorityPool = new WorkerPool("correlation-normal", config.normalPriorityPool());
        this.classifier = new PriorityClassifier();

        ClockTicker ticker = new ClockTicker(clock);
        this.ruleCache = new RuleEvaluationCache(config.ruleCacheTtl(), ticker);
        this.fastPathCache = new FastPathCache(() -> settings.current().cacheExpirationMs(), ticker);

        this.indexManager = new RuleIndexManager(ruleStore, tracer);
        this.indexManager.addSwapListener(index -> {
            ruleCache.invalidateAll();
            fastPathCache.invalidateAll();
            ruleMetrics.retainRules(index.ruleIds());
        });
        this.indexManager.setWarmupCallback(this::warmUp);

        this.evaluationExecutor = Executors.newFixedThreadPool(config.evaluationThreads(),
                new ThreadFactoryBuilder().setNameFormat("rule-eval-%d").setDaemon(true).build());
        RuleRunner runner = new RuleRunner(ruleEvaluator, ruleCache, metrics, ruleMetrics);
        this.pathSelector = new EvaluationPathSelector(indexManager, fastPathCache, runner,
                evaluationExecutor, metrics, config, normalPriorityPool::queued);

        this.eventBuffers = new EventBufferStore(config.bufferRetention(), config.bufferTrimThreshold(),
                config.bufferTrimCap(), config.bufferSweepCap(), clock);
        this.performanceWindow = new PerformanceWindow(config.performanceWindowSize(),
                config.p99MinSamples(), config.averageSmoothing());
        this.tuner = new AdaptiveTuner(settings, performanceWindow, config.tunerQueueThreshold(),
                config.tunerBatchFloor(), config.tunerBatchStep());
        this.dispatcher = new MatchDispatcher(incidentManager, actionExecutor, new IncidentFactory(clock),
                metrics, ruleMetrics, config.dispatcherThreads(), config.dispatcherQueueCapacity());

        this.batchWorkers = Executors.newFixedThreadPool(config.batchChunkSize(),
                new ThreadFactoryBuilder().setNameFormat("batch-worker-%d").setDaemon(true).build());
        this.batchAggregator = new BatchAggregator(config.batchMaxDelay(), this::processBatch);
        this.admission = new AdmissionController(circuitBreaker, this::inFlight);
        this.maintenance = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("correlation-maintenance").setDaemon(true).build());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Lifecycle ====================

    @Override
    public void initialize() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            logger.warning("Correlation engine already initialized or shut down, state=" + state.get());
            return;
        }
        try {
            reloadRules();
        } catch (RuleLoadException e) {
            logger.log(Level.WARNING, "Initial rule load failed, starting with no active rules", e);
        }

        scheduleMaintenance("performance-cycle", this::runPerformanceCycle, config.tunerInterval());
        scheduleMaintenance("cache-sweep", this::runCacheSweep, config.cacheSweepInterval());
        scheduleMaintenance("buffer-sweep", this::runBufferSweep, config.bufferSweepInterval());

        logger.info(String.format("Correlation engine started: %d active rules, runtime=%s",
                indexManager.current().activeRules(), settings.current()));
    }

    private void scheduleMaintenance(String name, Runnable task, Duration interval) {
        long millis = interval.toMillis();
        maintenance.scheduleAtFixedRate(() -> {
            try {
                task.run();
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Maintenance task " + name + " failed", e);
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void shutdown() {
        State previous = state.getAndUpdate(s ->
                s == State.NEW || s == State.RUNNING ? State.SHUTTING_DOWN : s);
        if (previous == State.SHUTTING_DOWN || previous == State.TERMINATED) {
            return;
        }
        logger.info("Shutting down correlation engine...");
        Duration drain = config.shutdownDrainTimeout();

        maintenance.shutdownNow();
        batchAggregator.stop(drain);
        highPriorityPool.shutdown(drain);
        normalPriorityPool.shutdown(drain);
        dispatcher.shutdown(drain);
        stopExecutor(batchWorkers, "batch workers", drain);
        stopExecutor(evaluationExecutor, "rule evaluation", drain);
        closeCollaborators();

        state.set(State.TERMINATED);
        logger.info(String.format("Correlation engine stopped: received=%d processed=%d dropped=%s",
                metrics.received(), metrics.processed(), metrics.droppedByReason()));
    }

    private static void stopExecutor(ExecutorService executor, String name, Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warning("Executor " + name + " did not terminate in time");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void closeCollaborators() {
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Object collaborator : List.of(ruleStore, ruleEvaluator, patternMatcher, incidentManager, actionExecutor)) {
            if (!(collaborator instanceof AutoCloseable) || !seen.add(collaborator)) {
                continue;
            }
            try {
                ((AutoCloseable) collaborator).close();
            } catch (Exception e) {
                logger.log(Level.WARNING, "Failed to close " + collaborator.getClass().getSimpleName(), e);
            }
        }
    }

    public State state() {
        return state.get();
    }

    // ==================== Ingress ====================

    @Override
    public ProcessingOutcome processEvent(Event event) {
        State current = state.get();
        if (current == State.SHUTTING_DOWN || current == State.TERMINATED) {
            metrics.eventDropped(DROP_SHUTDOWN);
            return ProcessingOutcome.rejected(Disposition.REJECTED_SHUTDOWN);
        }
        metrics.eventReceived();

        if (event == null || isBlank(event.eventType()) || isBlank(event.source())) {
            metrics.eventDropped(DROP_INVALID);
            logger.fine(() -> "Rejected event without type or source: " + event);
            return ProcessingOutcome.rejected(Disposition.REJECTED_INVALID);
        }

        RuntimeConfig runtime = settings.current();
        AdmissionController.Decision decision = admission.admit(runtime);
        if (decision != AdmissionController.Decision.ADMITTED) {
            boolean circuitOpen = decision == AdmissionController.Decision.CIRCUIT_OPEN;
            String reason = circuitOpen ? DROP_CIRCUIT_OPEN : DROP_OVERLOAD;
            metrics.eventDropped(reason);
            if (dropWarningLimiter.tryAcquire()) {
                logger.warning(String.format("Dropping event %s (%s), %d dropped for this reason so far",
                        event.id(), reason, metrics.dropped(reason)));
            }
            return ProcessingOutcome.rejected(circuitOpen
                    ? Disposition.REJECTED_CIRCUIT_OPEN
                    : Disposition.REJECTED_OVERLOAD);
        }

        if (runtime.streamProcessingMode()) {
            timed(event, () -> processStream(event));
            return new ProcessingOutcome(Disposition.STREAMED, CompletableFuture.completedFuture(null));
        }
        if (runtime.batchProcessingEnabled()) {
            return new ProcessingOutcome(Disposition.BATCHED, batchAggregator.add(event, runtime.batchSize()));
        }

        EventPriority priority = runtime.priorityQueueEnabled() ? classifier.classify(event) : EventPriority.NORMAL;
        if (priority == EventPriority.HIGH) {
            return new ProcessingOutcome(Disposition.ROUTED_HIGH,
                    highPriorityPool.submit(() -> timed(event, () -> processRealtime(event))));
        }
        return new ProcessingOutcome(Disposition.ROUTED_NORMAL,
                normalPriorityPool.submit(() -> timed(event, () -> processRealtime(event))));
    }

    /**
     * Events accepted and not yet processed: both priority pools plus the
     * batch backlog.
     */
    private int inFlight() {
        return highPriorityPool.inFlight() + normalPriorityPool.inFlight() + batchAggregator.backlog();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Runs the processing of one event, feeding its duration to the
     * performance window and the circuit breaker. Never throws.
     */
    private void timed(Event event, Runnable processing) {
        long start = clock.millis();
        try {
            processing.run();
            long elapsed = clock.millis() - start;
            performanceWindow.record(elapsed);
            metrics.eventProcessed(Duration.ofMillis(elapsed));
            if (elapsed > settings.current().maxProcessingTimeMs()) {
                circuitBreaker.recordSlow();
            } else {
                circuitBreaker.recordSuccess();
            }
        } catch (RuntimeException e) {
            circuitBreaker.recordFailure();
            logger.log(Level.WARNING, "Failed to process event " + event.id(), e);
        }
    }

    private void processRealtime(Event event) {
        eventBuffers.append(event);
        EvaluationOutcome outcome = pathSelector.evaluate(event, settings.current());
        logOutcome(event, outcome);
        dispatchMatches(event, outcome);
        if (outcome.path() == EvaluationPath.STANDARD_PARALLEL
                || outcome.path() == EvaluationPath.STANDARD_SEQUENTIAL) {
            runPatternMatching(event);
        }
    }

    private void processStream(Event event) {
        eventBuffers.append(event);
        EvaluationOutcome outcome = pathSelector.evaluateStream(event);
        logOutcome(event, outcome);
        dispatchMatches(event, outcome);
        runPatternMatching(event);
    }

    private static void logOutcome(Event event, EvaluationOutcome outcome) {
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Event %s: path=%s candidates=%d matches=%d",
                    event.id(), outcome.path(), outcome.candidateCount(), outcome.matches().size()));
        }
    }

    private void dispatchMatches(Event event, EvaluationOutcome outcome) {
        for (Match match : outcome.matches()) {
            metrics.matched();
            dispatcher.dispatch(match.rule(), event, match.result());
        }
    }

    private void runPatternMatching(Event event) {
        List<PatternMatch> patterns = patternMatcher.findMatches(event, eventBuffers);
        if (patterns == null) {
            return;
        }
        for (PatternMatch pattern : patterns) {
            dispatcher.dispatchPattern(pattern, event);
        }
    }

    /**
     * Processes a flushed batch chunk by chunk, each chunk's events
     * concurrently through the stream logic.
     */
    private void processBatch(List<Event> batch) {
        Span span = tracer.spanBuilder("batch-flush").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = clock.millis();
            int chunkSize = config.batchChunkSize();
            for (int from = 0; from < batch.size(); from += chunkSize) {
                List<Event> chunk = batch.subList(from, Math.min(from + chunkSize, batch.size()));
                List<CompletableFuture<Void>> running = new ArrayList<>(chunk.size());
                for (Event event : chunk) {
                    running.add(runOnBatchWorker(() -> timed(event, () -> processStream(event))));
                }
                CompletableFuture.allOf(running.toArray(new CompletableFuture[0])).join();
            }
            long elapsed = clock.millis() - start;
            lastBatchSize = batch.size();
            lastBatchProcessingMs = elapsed;
            lastBatchThroughput = elapsed > 0 ? batch.size() * 1000.0 / elapsed : batch.size() * 1000.0;
            batchesFlushed.incrementAndGet();
            span.setAttribute("batch.size", batch.size());
            span.setAttribute("batch.durationMs", elapsed);
            logger.info(String.format("Batch of %d events processed in %d ms (%.1f events/s)",
                    batch.size(), elapsed, lastBatchThroughput));
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private CompletableFuture<Void> runOnBatchWorker(Runnable task) {
        try {
            return CompletableFuture.runAsync(task, batchWorkers);
        } catch (RejectedExecutionException e) {
            task.run();
            return CompletableFuture.completedFuture(null);
        }
    }

    // ==================== Rules ====================

    @Override
    public void reloadRules() throws RuleLoadException {
        indexManager.reload();
    }

    private void warmUp(RuleIndex index) {
        int lookups = 0;
        int candidates = 0;
        for (String eventType : WARMUP_EVENT_TYPES) {
            for (String source : WARMUP_SOURCES) {
                int count = index.candidates(Event.of("warmup", eventType, source, clock.instant())).size();
                lookups++;
                candidates += count;
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine(String.format("Warm-up %s/%s: %d candidate rules", eventType, source, count));
                }
            }
        }
        logger.info(String.format("Warm-up computed %d lookups, %d candidate rules in total", lookups, candidates));
    }

    // ==================== Maintenance ====================

    void runPerformanceCycle() {
        double average = performanceWindow.average();
        double p99 = performanceWindow.p99();
        RuntimeConfig runtime = settings.current();
        logger.info(String.format(
                "Performance: avg=%.1f ms, p99=%.1f ms, samples=%d, processed=%d, queues high=%d normal=%d, mode=%s",
                average, p99, performanceWindow.sampleCount(), metrics.processed(),
                highPriorityPool.queued(), normalPriorityPool.queued(), modeName(runtime)));
        if (performanceWindow.sampleCount() >= performanceWindow.minSamples()
                && average > runtime.maxProcessingTimeMs()) {
            logger.warning(String.format("Average processing time %.1f ms exceeds target %d ms",
                    average, runtime.maxProcessingTimeMs()));
        }
        tuner.tune(highPriorityPool.queued(), normalPriorityPool.queued());
        metrics.updateGauges(highPriorityPool.queued(), normalPriorityPool.queued(), p99, average,
                indexManager.current().activeRules());
    }

    private static String modeName(RuntimeConfig runtime) {
        if (runtime.streamProcessingMode()) {
            return "stream";
        }
        return runtime.batchProcessingEnabled() ? "batch" : "realtime";
    }

    void runCacheSweep() {
        ruleCache.sweep();
        fastPathCache.sweep();
    }

    void runBufferSweep() {
        eventBuffers.sweep();
    }

    // ==================== Configuration & stats ====================

    @Override
    public RuntimeConfig updateRuntimeConfig(RuntimeConfigPatch patch) {
        RuntimeConfig updated = settings.apply(patch);
        logger.info("Runtime configuration updated by operator: " + updated);
        return updated;
    }

    @Override
    public RuntimeConfig getRuntimeConfig() {
        return settings.current();
    }

    @Override
    public void enableStreamMode() {
        settings.apply(RuntimeConfigPatch.builder().streamProcessingMode(true).build());
        logger.info("Stream processing mode enabled");
    }

    @Override
    public void disableStreamMode() {
        settings.apply(RuntimeConfigPatch.builder().streamProcessingMode(false).build());
        logger.info("Stream processing mode disabled");
    }

    @Override
    public EngineStats getEngineStats() {
        RuleIndex index = indexManager.current();
        return new EngineStats(
                index.activeRules(),
                new EngineStats.IndexStats(index.indexedKeyCount(), index.membershipEntryCount(),
                        index.totalIndexEntries()),
                new EngineStats.QueueStats(highPriorityPool.queued(), normalPriorityPool.queued(),
                        highPriorityPool.active(), normalPriorityPool.active(),
                        highPriorityPool.expired() + normalPriorityPool.expired(),
                        batchAggregator.backlog()),
                new EngineStats.CacheStats(ruleCache.size(), fastPathCache.size(),
                        metrics.cacheHits(), metrics.cacheMisses()),
                new EngineStats.PerformanceStats(performanceWindow.average(), performanceWindow.p99(),
                        performanceWindow.sampleCount(), metrics.received(), metrics.processed(),
                        metrics.ruleEvaluations(), metrics.evaluationErrors(), metrics.matches()),
                circuitBreaker.snapshot(),
                new EngineStats.BufferStats(eventBuffers.totalEvents(), eventBuffers.keyCount()),
                new EngineStats.BatchStats(batchAggregator.pending(), lastBatchSize, lastBatchProcessingMs,
                        lastBatchThroughput, batchesFlushed.get()),
                metrics.droppedByReason(),
                metrics.dispatchRejectedCount(),
                settings.current(),
                clock.instant());
    }

    public RuleMetricsAggregator getRuleMetrics() {
        return ruleMetrics;
    }

    public EventBufferView getEventBuffers() {
        return eventBuffers;
    }

    // ==================== Builder ====================

    public static final class Builder {
        private RuleStore ruleStore;
        private RuleEvaluator ruleEvaluator;
        private IncidentManager incidentManager;
        private PatternMatcher patternMatcher = PatternMatcher.NONE;
        private ActionExecutor actionExecutor = ActionExecutor.NONE;
        private EngineConfig config;
        private MetricsRegistry metrics;
        private Tracer tracer;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder ruleStore(RuleStore ruleStore) { this.ruleStore = ruleStore; return this; }
        public Builder ruleEvaluator(RuleEvaluator ruleEvaluator) { this.ruleEvaluator = ruleEvaluator; return this; }
        public Builder incidentManager(IncidentManager incidentManager) { this.incidentManager = incidentManager; return this; }
        public Builder patternMatcher(PatternMatcher patternMatcher) { this.patternMatcher = patternMatcher; return this; }
        public Builder actionExecutor(ActionExecutor actionExecutor) { this.actionExecutor = actionExecutor; return this; }
        public Builder config(EngineConfig config) { this.config = config; return this; }
        public Builder metrics(MetricsRegistry metrics) { this.metrics = metrics; return this; }
        public Builder tracer(Tracer tracer) { this.tracer = tracer; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }

        /**
         * @throws IllegalArgumentException if a required collaborator is missing
         */
        public CorrelationEngine build() {
            if (ruleStore == null) {
                throw new IllegalArgumentException("ruleStore is required");
            }
            if (ruleEvaluator == null) {
                throw new IllegalArgumentException("ruleEvaluator is required");
            }
            if (incidentManager == null) {
                throw new IllegalArgumentException("incidentManager is required");
            }
            if (patternMatcher == null) {
                patternMatcher = PatternMatcher.NONE;
            }
            if (actionExecutor == null) {
                actionExecutor = ActionExecutor.NONE;
            }
            if (config == null) {
                config = EngineConfig.defaults();
            }
            if (metrics == null) {
                metrics = MetricsRegistry.getInstance();
            }
            if (tracer == null) {
                tracer = TracingService.getInstance().getTracer();
            }
            if (clock == null) {
                clock = Clock.systemUTC();
            }
            return new CorrelationEngine(this);
        }
    }
}
