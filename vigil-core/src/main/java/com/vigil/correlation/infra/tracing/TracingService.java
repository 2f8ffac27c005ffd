package com.vigil.correlation.infra.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * OpenTelemetry tracing for the correlation engine.
 *
 * <p>The engine only traces coarse operations (rule reload, cache warm-up,
 * batch flush), never individual events, so spans are cheap relative to the
 * work they wrap.
 *
 * Configuration via environment variables or system properties:
 * - OTEL_DISABLED: Disable tracing entirely (default: false)
 * - OTEL_EXPORTER_TYPE: otlp|logging (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default depends on DEPLOYMENT_ENVIRONMENT)
 * - SERVICE_NAME: Service identifier (default: vigil-correlation-engine)
 * - SERVICE_VERSION: Deployment version (default: unknown)
 * - DEPLOYMENT_ENVIRONMENT: prod|staging|dev (default: dev)
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.vigil.correlation-engine";
    private static final String DEFAULT_SERVICE_NAME = "vigil-correlation-engine";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;
    private final boolean isNoop;

    private TracingService(OpenTelemetry openTelemetry, Tracer tracer,
                           SdkTracerProvider tracerProvider, boolean isNoop) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.tracerProvider = tracerProvider;
        this.isNoop = isNoop;

        if (!isNoop) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "otel-shutdown-hook"));
        }
    }

    /**
     * Get singleton instance with double-checked locking.
     */
    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    /**
     * A tracing service that records nothing. Used by tests and by engines
     * built without explicit tracing.
     */
    public static TracingService noop() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new TracingService(noop, noop.getTracer(INSTRUMENTATION_NAME), null, true);
    }

    private static TracingService initialize() {
        try {
            if (isTracingDisabled()) {
                logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
                return noop();
            }

            Sampler sampler = configureSampler();
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(buildResource())
                    .setSampler(sampler)
                    .addSpanProcessor(
                            BatchSpanProcessor.builder(configureExporter())
                                    .setMaxQueueSize(2048)
                                    .setMaxExportBatchSize(256)
                                    .setScheduleDelay(Duration.ofSeconds(5))
                                    .setExporterTimeout(Duration.ofSeconds(30))
                                    .build())
                    .build();

            // Not registered globally: several engines may share a JVM in tests
            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format(
                    "OpenTelemetry initialized: service=%s, version=%s, env=%s, sampler=%s",
                    getServiceName(), getServiceVersion(), getEnvironment(), sampler.getDescription()));

            return new TracingService(sdk, sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider, false);

        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static Resource buildResource() {
        return Resource.getDefault().merge(
                Resource.create(Attributes.builder()
                        .put(SERVICE_NAME, getServiceName())
                        .put(SERVICE_VERSION, getServiceVersion())
                        .put(DEPLOYMENT_ENVIRONMENT, getEnvironment())
                        .build()));
    }

    private static Sampler configureSampler() {
        String defaultRatio = defaultSamplingRatio();
        double samplingRatio;
        try {
            samplingRatio = Double.parseDouble(getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", defaultRatio));
            samplingRatio = Math.max(0.0, Math.min(1.0, samplingRatio));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using default " + defaultRatio);
            samplingRatio = Double.parseDouble(defaultRatio);
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(samplingRatio)).build();
    }

    private static String defaultSamplingRatio() {
        return switch (getEnvironment().toLowerCase(Locale.ROOT)) {
            case "prod", "production" -> "0.1";
            case "staging" -> "0.5";
            default -> "1.0";
        };
    }

    private static SpanExporter configureExporter() {
        String exporterType = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase(Locale.ROOT);

        return switch (exporterType) {
            case "otlp" -> {
                String endpoint = getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
                logger.info("Using OTLP exporter: " + endpoint);
                yield OtlpGrpcSpanExporter.builder()
                        .setEndpoint(endpoint)
                        .setTimeout(30, TimeUnit.SECONDS)
                        .build();
            }
            case "logging" -> LoggingSpanExporter.create();
            default -> {
                logger.warning("Unknown exporter type: " + exporterType + ", using logging");
                yield LoggingSpanExporter.create();
            }
        };
    }

    /**
     * Drains pending spans, waiting at most 30 seconds.
     */
    public void shutdown() {
        if (isNoop || tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
            logger.info("OpenTelemetry shutdown complete");
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return !isNoop;
    }

    private static boolean isTracingDisabled() {
        return Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"));
    }

    private static String getServiceName() {
        return getEnvOrProperty("SERVICE_NAME", getEnvOrProperty("OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME));
    }

    private static String getServiceVersion() {
        return getEnvOrProperty("SERVICE_VERSION", "unknown");
    }

    private static String getEnvironment() {
        return getEnvOrProperty("DEPLOYMENT_ENVIRONMENT", "dev");
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
