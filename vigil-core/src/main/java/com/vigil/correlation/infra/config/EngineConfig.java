/*
 * Copyright (c) 2025 Vigil Correlation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.vigil.correlation.infra.config;

import com.vigil.correlation.api.model.RuntimeConfig;
import com.vigil.correlation.api.model.RuntimeConfigPatch;

import java.io.FileInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Process-level configuration of the correlation engine.
 *
 * <p>Values are resolved in this order, later sources winning:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code correlation.properties} (classpath first, then file system)</li>
 *   <li>environment variables, named after the property key upper-cased with
 *       dots replaced by underscores ({@code correlation.circuit.threshold}
 *       becomes {@code CORRELATION_CIRCUIT_THRESHOLD})</li>
 * </ol>
 *
 * <p>Durations are given in milliseconds. Example:
 * <pre>
 * correlation.circuit.threshold=5
 * correlation.circuit.timeout.ms=30000
 * correlation.pool.high.concurrency=20
 * correlation.runtime.max.processing.time.ms=200
 * correlation.runtime.batch.size=50
 * </pre>
 *
 * <p>The {@code correlation.runtime.*} keys seed the initial
 * {@link RuntimeConfig}; everything else is fixed for the lifetime of an
 * engine.
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "correlation.properties";

    // Admission
    private final int circuitBreakerThreshold;
    private final Duration circuitBreakerTimeout;

    // Worker pools
    private final PoolSettings highPriorityPool;
    private final PoolSettings normalPriorityPool;
    private final int evaluationThreads;

    // Caches
    private final Duration ruleCacheTtl;
    private final Duration cacheSweepInterval;

    // Buffers
    private final Duration bufferSweepInterval;
    private final Duration bufferRetention;
    private final int bufferTrimThreshold;
    private final int bufferTrimCap;
    private final int bufferSweepCap;

    // Batch and evaluation paths
    private final Duration batchMaxDelay;
    private final int batchChunkSize;
    private final int streamConcurrency;
    private final int parallelChunkSize;
    private final int parallelQueueThreshold;
    private final int sequentialCap;
    private final int fastPathTopN;
    private final int fastPathMaxCandidates;

    // Tuning
    private final Duration tunerInterval;
    private final int tunerQueueThreshold;
    private final int tunerBatchFloor;
    private final int tunerBatchStep;
    private final int performanceWindowSize;
    private final int p99MinSamples;
    private final double averageSmoothing;

    // Dispatch and shutdown
    private final int dispatcherThreads;
    private final int dispatcherQueueCapacity;
    private final Duration shutdownDrainTimeout;

    private final RuntimeConfig initialRuntime;

    /**
     * Concurrency, timeout and start-rate cap of one worker pool.
     *
     * @param concurrency maximum tasks running at once
     * @param timeout     maximum time a task may wait and run before being abandoned
     * @param intervalCap maximum tasks started per interval
     * @param interval    length of the start-rate interval
     */
    public record PoolSettings(int concurrency, Duration timeout, int intervalCap, Duration interval) {
        public PoolSettings {
            if (concurrency <= 0) {
                throw new IllegalArgumentException("Pool concurrency must be positive: " + concurrency);
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Pool timeout must be positive: " + timeout);
            }
            if (intervalCap <= 0 || interval == null || interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException(
                        "Pool interval cap must be positive: " + intervalCap + " per " + interval);
            }
        }

        /**
         * Permitted task starts per second.
         */
        public double startsPerSecond() {
            return intervalCap * 1000.0 / interval.toMillis();
        }
    }

    private EngineConfig(Builder b) {
        this.circuitBreakerThreshold = b.circuitBreakerThreshold;
        this.circuitBreakerTimeout = b.circuitBreakerTimeout;
        this.highPriorityPool = new PoolSettings(b.highConcurrency, b.highTimeout, b.highIntervalCap, b.highInterval);
        this.normalPriorityPool = new PoolSettings(b.normalConcurrency, b.normalTimeout, b.normalIntervalCap, b.normalInterval);
        this.evaluationThreads = b.evaluationThreads;
        this.ruleCacheTtl = b.ruleCacheTtl;
        this.cacheSweepInterval = b.cacheSweepInterval;
        this.bufferSweepInterval = b.bufferSweepInterval;
        this.bufferRetention = b.bufferRetention;
        this.bufferTrimThreshold = b.bufferTrimThreshold;
        this.bufferTrimCap = b.bufferTrimCap;
        this.bufferSweepCap = b.bufferSweepCap;
        this.batchMaxDelay = b.batchMaxDelay;
        this.batchChunkSize = b.batchChunkSize;
        this.streamConcurrency = b.streamConcurrency;
        this.parallelChunkSize = b.parallelChunkSize;
        this.parallelQueueThreshold = b.parallelQueueThreshold;
        this.sequentialCap = b.sequentialCap;
        this.fastPathTopN = b.fastPathTopN;
        this.fastPathMaxCandidates = b.fastPathMaxCandidates;
        this.tunerInterval = b.tunerInterval;
        this.tunerQueueThreshold = b.tunerQueueThreshold;
        this.tunerBatchFloor = b.tunerBatchFloor;
        this.tunerBatchStep = b.tunerBatchStep;
        this.performanceWindowSize = b.performanceWindowSize;
        this.p99MinSamples = b.p99MinSamples;
        this.averageSmoothing = b.averageSmoothing;
        this.dispatcherThreads = b.dispatcherThreads;
        this.dispatcherQueueCapacity = b.dispatcherQueueCapacity;
        this.shutdownDrainTimeout = b.shutdownDrainTimeout;
        this.initialRuntime = b.initialRuntime;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES} with environment overrides.
     */
    public static EngineConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads configuration from a properties file looked up on the classpath
     * first and then on the file system. A missing file falls back to the
     * defaults. Environment variables override file values.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static EngineConfig loadFromProperties(String propertiesPath) {
        Properties props = new Properties();

        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (Exception e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (Exception e) {
                logger.info("No configuration file " + propertiesPath + ", using defaults");
            }
        }

        return fromSources(props, System.getenv());
    }

    /**
     * Builds a configuration from explicit sources. Environment entries win
     * over properties.
     */
    public static EngineConfig fromSources(Properties props, Map<String, String> env) {
        Builder builder = builder();
        for (Map.Entry<String, BiConsumer<Builder, String>> setting : SETTINGS.entrySet()) {
            String key = setting.getKey();
            Optional<String> value = Optional.ofNullable(env.get(envName(key)))
                    .or(() -> Optional.ofNullable(props.getProperty(key)))
                    .map(String::trim)
                    .filter(v -> !v.isEmpty());
            if (value.isPresent()) {
                try {
                    setting.getValue().accept(builder, value.get());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(
                            "Invalid value for " + key + ": " + value.get(), e);
                }
            }
        }
        return builder.build();
    }

    static String envName(String propertyKey) {
        return propertyKey.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    // ========================================================================
    // PROPERTY TABLE
    // ========================================================================

    private static final Map<String, BiConsumer<Builder, String>> SETTINGS = new LinkedHashMap<>();

    static {
        integer("correlation.circuit.threshold", (b, v) -> b.circuitBreakerThreshold = v);
        millis("correlation.circuit.timeout.ms", (b, v) -> b.circuitBreakerTimeout = v);

        integer("correlation.pool.high.concurrency", (b, v) -> b.highConcurrency = v);
        millis("correlation.pool.high.timeout.ms", (b, v) -> b.highTimeout = v);
        integer("correlation.pool.high.interval.cap", (b, v) -> b.highIntervalCap = v);
        millis("correlation.pool.high.interval.ms", (b, v) -> b.highInterval = v);
        integer("correlation.pool.normal.concurrency", (b, v) -> b.normalConcurrency = v);
        millis("correlation.pool.normal.timeout.ms", (b, v) -> b.normalTimeout = v);
        integer("correlation.pool.normal.interval.cap", (b, v) -> b.normalIntervalCap = v);
        millis("correlation.pool.normal.interval.ms", (b, v) -> b.normalInterval = v);
        integer("correlation.evaluation.threads", (b, v) -> b.evaluationThreads = v);

        millis("correlation.cache.rule.ttl.ms", (b, v) -> b.ruleCacheTtl = v);
        millis("correlation.cache.sweep.interval.ms", (b, v) -> b.cacheSweepInterval = v);

        millis("correlation.buffer.sweep.interval.ms", (b, v) -> b.bufferSweepInterval = v);
        millis("correlation.buffer.retention.ms", (b, v) -> b.bufferRetention = v);
        integer("correlation.buffer.trim.threshold", (b, v) -> b.bufferTrimThreshold = v);
        integer("correlation.buffer.trim.cap", (b, v) -> b.bufferTrimCap = v);
        integer("correlation.buffer.sweep.cap", (b, v) -> b.bufferSweepCap = v);

        millis("correlation.batch.max.delay.ms", (b, v) -> b.batchMaxDelay = v);
        integer("correlation.batch.chunk.size", (b, v) -> b.batchChunkSize = v);
        integer("correlation.stream.concurrency", (b, v) -> b.streamConcurrency = v);
        integer("correlation.parallel.chunk.size", (b, v) -> b.parallelChunkSize = v);
        integer("correlation.parallel.queue.threshold", (b, v) -> b.parallelQueueThreshold = v);
        integer("correlation.sequential.cap", (b, v) -> b.sequentialCap = v);
        integer("correlation.fastpath.top.n", (b, v) -> b.fastPathTopN = v);
        integer("correlation.fastpath.max.candidates", (b, v) -> b.fastPathMaxCandidates = v);

        millis("correlation.tuner.interval.ms", (b, v) -> b.tunerInterval = v);
        integer("correlation.tuner.queue.threshold", (b, v) -> b.tunerQueueThreshold = v);
        integer("correlation.tuner.batch.floor", (b, v) -> b.tunerBatchFloor = v);
        integer("correlation.tuner.batch.step", (b, v) -> b.tunerBatchStep = v);
        integer("correlation.performance.window.size", (b, v) -> b.performanceWindowSize = v);
        integer("correlation.performance.p99.min.samples", (b, v) -> b.p99MinSamples = v);
        decimal("correlation.performance.average.smoothing", (b, v) -> b.averageSmoothing = v);

        integer("correlation.dispatcher.threads", (b, v) -> b.dispatcherThreads = v);
        integer("correlation.dispatcher.queue.capacity", (b, v) -> b.dispatcherQueueCapacity = v);
        millis("correlation.shutdown.drain.timeout.ms", (b, v) -> b.shutdownDrainTimeout = v);

        runtime("correlation.runtime.max.processing.time.ms", Long::parseLong,
                (p, v) -> p.maxProcessingTimeMs(v));
        runtime("correlation.runtime.batch.processing.enabled", Boolean::parseBoolean,
                (p, v) -> p.batchProcessingEnabled(v));
        runtime("correlation.runtime.batch.size", Integer::parseInt, (p, v) -> p.batchSize(v));
        runtime("correlation.runtime.cache.expiration.ms", Long::parseLong,
                (p, v) -> p.cacheExpirationMs(v));
        runtime("correlation.runtime.parallel.rule.evaluation", Boolean::parseBoolean,
                (p, v) -> p.parallelRuleEvaluation(v));
        runtime("correlation.runtime.fast.path.enabled", Boolean::parseBoolean,
                (p, v) -> p.fastPathEnabled(v));
        runtime("correlation.runtime.stream.processing.mode", Boolean::parseBoolean,
                (p, v) -> p.streamProcessingMode(v));
        runtime("correlation.runtime.enable.circuit.breaker", Boolean::parseBoolean,
                (p, v) -> p.enableCircuitBreaker(v));
        runtime("correlation.runtime.max.concurrent.events", Integer::parseInt,
                (p, v) -> p.maxConcurrentEvents(v));
        runtime("correlation.runtime.priority.queue.enabled", Boolean::parseBoolean,
                (p, v) -> p.priorityQueueEnabled(v));
    }

    private static void integer(String key, BiConsumer<Builder, Integer> setter) {
        SETTINGS.put(key, (b, v) -> setter.accept(b, Integer.parseInt(v)));
    }

    private static void decimal(String key, BiConsumer<Builder, Double> setter) {
        SETTINGS.put(key, (b, v) -> setter.accept(b, Double.parseDouble(v)));
    }

    private static void millis(String key, BiConsumer<Builder, Duration> setter) {
        SETTINGS.put(key, (b, v) -> setter.accept(b, Duration.ofMillis(Long.parseLong(v))));
    }

    private static <T> void runtime(String key, Function<String, T> parser,
                                    BiConsumer<RuntimeConfigPatch.Builder, T> setter) {
        SETTINGS.put(key, (b, v) -> {
            RuntimeConfigPatch.Builder patch = RuntimeConfigPatch.builder();
            setter.accept(patch, parser.apply(v));
            b.initialRuntime = b.initialRuntime.merge(patch.build());
        });
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        requirePositive("circuitBreakerThreshold", circuitBreakerThreshold);
        requirePositive("circuitBreakerTimeout", circuitBreakerTimeout);
        requirePositive("evaluationThreads", evaluationThreads);
        requirePositive("ruleCacheTtl", ruleCacheTtl);
        requirePositive("cacheSweepInterval", cacheSweepInterval);
        requirePositive("bufferSweepInterval", bufferSweepInterval);
        requirePositive("bufferRetention", bufferRetention);
        requirePositive("bufferTrimThreshold", bufferTrimThreshold);
        requirePositive("bufferTrimCap", bufferTrimCap);
        requirePositive("bufferSweepCap", bufferSweepCap);
        requirePositive("batchMaxDelay", batchMaxDelay);
        requirePositive("batchChunkSize", batchChunkSize);
        requirePositive("streamConcurrency", streamConcurrency);
        requirePositive("parallelChunkSize", parallelChunkSize);
        requirePositive("parallelQueueThreshold", parallelQueueThreshold);
        requirePositive("sequentialCap", sequentialCap);
        requirePositive("fastPathTopN", fastPathTopN);
        requirePositive("fastPathMaxCandidates", fastPathMaxCandidates);
        requirePositive("tunerInterval", tunerInterval);
        requirePositive("tunerQueueThreshold", tunerQueueThreshold);
        requirePositive("tunerBatchFloor", tunerBatchFloor);
        requirePositive("tunerBatchStep", tunerBatchStep);
        requirePositive("performanceWindowSize", performanceWindowSize);
        requirePositive("p99MinSamples", p99MinSamples);
        requirePositive("dispatcherThreads", dispatcherThreads);
        requirePositive("dispatcherQueueCapacity", dispatcherQueueCapacity);
        requirePositive("shutdownDrainTimeout", shutdownDrainTimeout);

        if (bufferTrimCap > bufferTrimThreshold) {
            throw new IllegalArgumentException(String.format(
                    "bufferTrimCap (%d) must not exceed bufferTrimThreshold (%d)",
                    bufferTrimCap, bufferTrimThreshold));
        }
        if (p99MinSamples > performanceWindowSize) {
            throw new IllegalArgumentException(String.format(
                    "p99MinSamples (%d) must not exceed performanceWindowSize (%d)",
                    p99MinSamples, performanceWindowSize));
        }
        if (averageSmoothing <= 0.0 || averageSmoothing > 1.0) {
            throw new IllegalArgumentException("averageSmoothing must be in (0, 1]: " + averageSmoothing);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public int circuitBreakerThreshold() { return circuitBreakerThreshold; }
    public Duration circuitBreakerTimeout() { return circuitBreakerTimeout; }
    public PoolSettings highPriorityPool() { return highPriorityPool; }
    public PoolSettings normalPriorityPool() { return normalPriorityPool; }
    public int evaluationThreads() { return evaluationThreads; }
    public Duration ruleCacheTtl() { return ruleCacheTtl; }
    public Duration cacheSweepInterval() { return cacheSweepInterval; }
    public Duration bufferSweepInterval() { return bufferSweepInterval; }
    public Duration bufferRetention() { return bufferRetention; }
    public int bufferTrimThreshold() { return bufferTrimThreshold; }
    public int bufferTrimCap() { return bufferTrimCap; }
    public int bufferSweepCap() { return bufferSweepCap; }
    public Duration batchMaxDelay() { return batchMaxDelay; }
    public int batchChunkSize() { return batchChunkSize; }
    public int streamConcurrency() { return streamConcurrency; }
    public int parallelChunkSize() { return parallelChunkSize; }
    public int parallelQueueThreshold() { return parallelQueueThreshold; }
    public int sequentialCap() { return sequentialCap; }
    public int fastPathTopN() { return fastPathTopN; }
    public int fastPathMaxCandidates() { return fastPathMaxCandidates; }
    public Duration tunerInterval() { return tunerInterval; }
    public int tunerQueueThreshold() { return tunerQueueThreshold; }
    public int tunerBatchFloor() { return tunerBatchFloor; }
    public int tunerBatchStep() { return tunerBatchStep; }
    public int performanceWindowSize() { return performanceWindowSize; }
    public int p99MinSamples() { return p99MinSamples; }
    public double averageSmoothing() { return averageSmoothing; }
    public int dispatcherThreads() { return dispatcherThreads; }
    public int dispatcherQueueCapacity() { return dispatcherQueueCapacity; }
    public Duration shutdownDrainTimeout() { return shutdownDrainTimeout; }
    public RuntimeConfig initialRuntime() { return initialRuntime; }

    @Override
    public String toString() {
        return String.format(
                "EngineConfig{circuit=%d/%dms, highPool=%s, normalPool=%s, evalThreads=%d, ruleCacheTtl=%dms, "
                        + "tunerInterval=%dms, runtime=%s}",
                circuitBreakerThreshold, circuitBreakerTimeout.toMillis(), highPriorityPool,
                normalPriorityPool, evaluationThreads, ruleCacheTtl.toMillis(),
                tunerInterval.toMillis(), initialRuntime);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int circuitBreakerThreshold = 5;
        private Duration circuitBreakerTimeout = Duration.ofSeconds(30);

        private int highConcurrency = 20;
        private Duration highTimeout = Duration.ofSeconds(2);
        private int highIntervalCap = 1000;
        private Duration highInterval = Duration.ofMillis(500);
        private int normalConcurrency = 50;
        private Duration normalTimeout = Duration.ofSeconds(5);
        private int normalIntervalCap = 2000;
        private Duration normalInterval = Duration.ofSeconds(1);
        private int evaluationThreads = 32;

        private Duration ruleCacheTtl = Duration.ofSeconds(10);
        private Duration cacheSweepInterval = Duration.ofSeconds(60);

        private Duration bufferSweepInterval = Duration.ofMinutes(2);
        private Duration bufferRetention = Duration.ofMinutes(30);
        private int bufferTrimThreshold = 100;
        private int bufferTrimCap = 50;
        private int bufferSweepCap = 100;

        private Duration batchMaxDelay = Duration.ofMillis(50);
        private int batchChunkSize = 10;
        private int streamConcurrency = 10;
        private int parallelChunkSize = 5;
        private int parallelQueueThreshold = 100;
        private int sequentialCap = 20;
        private int fastPathTopN = 3;
        private int fastPathMaxCandidates = 5;

        private Duration tunerInterval = Duration.ofSeconds(15);
        private int tunerQueueThreshold = 100;
        private int tunerBatchFloor = 20;
        private int tunerBatchStep = 10;
        private int performanceWindowSize = 1000;
        private int p99MinSamples = 10;
        private double averageSmoothing = 0.1;

        private int dispatcherThreads = 8;
        private int dispatcherQueueCapacity = 10_000;
        private Duration shutdownDrainTimeout = Duration.ofSeconds(30);

        private RuntimeConfig initialRuntime = RuntimeConfig.defaults();

        private Builder() {
        }

        public Builder circuitBreaker(int threshold, Duration timeout) {
            this.circuitBreakerThreshold = threshold;
            this.circuitBreakerTimeout = timeout;
            return this;
        }

        public Builder highPriorityPool(int concurrency, Duration timeout, int intervalCap, Duration interval) {
            this.highConcurrency = concurrency;
            this.highTimeout = timeout;
            this.highIntervalCap = intervalCap;
            this.highInterval = interval;
            return this;
        }

        public Builder normalPriorityPool(int concurrency, Duration timeout, int intervalCap, Duration interval) {
            this.normalConcurrency = concurrency;
            this.normalTimeout = timeout;
            this.normalIntervalCap = intervalCap;
            this.normalInterval = interval;
            return this;
        }

        public Builder evaluationThreads(int threads) { this.evaluationThreads = threads; return this; }
        public Builder ruleCacheTtl(Duration ttl) { this.ruleCacheTtl = ttl; return this; }
        public Builder cacheSweepInterval(Duration interval) { this.cacheSweepInterval = interval; return this; }
        public Builder bufferSweepInterval(Duration interval) { this.bufferSweepInterval = interval; return this; }
        public Builder bufferRetention(Duration retention) { this.bufferRetention = retention; return this; }

        public Builder bufferTrim(int threshold, int cap) {
            this.bufferTrimThreshold = threshold;
            this.bufferTrimCap = cap;
            return this;
        }

        public Builder bufferSweepCap(int cap) { this.bufferSweepCap = cap; return this; }
        public Builder batchMaxDelay(Duration delay) { this.batchMaxDelay = delay; return this; }
        public Builder batchChunkSize(int size) { this.batchChunkSize = size; return this; }
        public Builder streamConcurrency(int concurrency) { this.streamConcurrency = concurrency; return this; }
        public Builder parallelChunkSize(int size) { this.parallelChunkSize = size; return this; }
        public Builder parallelQueueThreshold(int threshold) { this.parallelQueueThreshold = threshold; return this; }
        public Builder sequentialCap(int cap) { this.sequentialCap = cap; return this; }

        public Builder fastPath(int topN, int maxCandidates) {
            this.fastPathTopN = topN;
            this.fastPathMaxCandidates = maxCandidates;
            return this;
        }

        public Builder tunerInterval(Duration interval) { this.tunerInterval = interval; return this; }
        public Builder tunerQueueThreshold(int threshold) { this.tunerQueueThreshold = threshold; return this; }

        public Builder tunerBatchSizing(int floor, int step) {
            this.tunerBatchFloor = floor;
            this.tunerBatchStep = step;
            return this;
        }

        public Builder performanceWindow(int size, int p99MinSamples) {
            this.performanceWindowSize = size;
            this.p99MinSamples = p99MinSamples;
            return this;
        }

        public Builder averageSmoothing(double alpha) { this.averageSmoothing = alpha; return this; }

        public Builder dispatcher(int threads, int queueCapacity) {
            this.dispatcherThreads = threads;
            this.dispatcherQueueCapacity = queueCapacity;
            return this;
        }

        public Builder shutdownDrainTimeout(Duration timeout) { this.shutdownDrainTimeout = timeout; return this; }

        public Builder initialRuntime(RuntimeConfig runtime) {
            this.initialRuntime = runtime;
            return this;
        }

        public EngineConfig build() {
            if (initialRuntime == null) {
                throw new IllegalArgumentException("initialRuntime must not be null");
            }
            return new EngineConfig(this);
        }
    }
}
