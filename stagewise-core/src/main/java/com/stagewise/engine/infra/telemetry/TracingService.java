package com.stagewise.engine.infra.telemetry;

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
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide OpenTelemetry setup for the navigation engine.
 *
 * <p>Spans are exported in batches off the request path. Navigation requests
 * are low volume compared to the spans they produce, so the default sampling
 * ratio stays high outside production.
 *
 * Configuration via environment variables or system properties:
 * - OTEL_DISABLED: disable tracing entirely (default: false)
 * - OTEL_EXPORTER_TYPE: otlp|logging (default: logging)
 * - OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)
 * - OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default depends on environment)
 * - SERVICE_NAME: service identifier (default: stagewise-engine)
 * - SERVICE_VERSION: deployment version (default: unknown)
 * - DEPLOYMENT_ENVIRONMENT: prod|staging|dev (default: dev)
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    public static final String INSTRUMENTATION_NAME = "com.stagewise.navigation-engine";
    private static final String DEFAULT_SERVICE_NAME = "stagewise-engine";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;
    private final boolean isNoop;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider, boolean isNoop) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;
        this.isNoop = isNoop;
    }

    /**
     * Singleton configured from the environment on first use.
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
     * Wraps an externally managed SDK, e.g. one backed by an in-memory
     * exporter in tests. Not registered globally and no shutdown hook.
     */
    public static TracingService using(OpenTelemetry openTelemetry) {
        return new TracingService(openTelemetry, null, false);
    }

    public static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null, true);
    }

    private static TracingService initialize() {
        try {
            if (Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"))) {
                logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
                return noop();
            }

            Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
                    .put(SERVICE_NAME, getServiceName())
                    .put(SERVICE_VERSION, getEnvOrProperty("SERVICE_VERSION", "unknown"))
                    .put(DEPLOYMENT_ENVIRONMENT, getEnvironment())
                    .build()));
            Sampler sampler = configureSampler();

            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(resource)
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(configureExporter())
                            .setMaxQueueSize(2048)
                            .setMaxExportBatchSize(256)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .setExporterTimeout(Duration.ofSeconds(30))
                            .build())
                    .build();

            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .buildAndRegisterGlobal();

            logger.info(String.format("OpenTelemetry initialized: service=%s, env=%s, sampler=%s",
                    getServiceName(), getEnvironment(), sampler.getDescription()));

            TracingService service = new TracingService(sdk, tracerProvider, false);
            service.registerShutdownHook();
            return service;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static Sampler configureSampler() {
        String defaultRatio = switch (getEnvironment().toLowerCase()) {
            case "prod", "production" -> "0.25";
            case "staging" -> "0.5";
            default -> "1.0";
        };
        double ratio;
        try {
            ratio = Double.parseDouble(getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", defaultRatio));
            ratio = Math.max(0.0, Math.min(1.0, ratio));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using " + defaultRatio);
            ratio = Double.parseDouble(defaultRatio);
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(ratio)).build();
    }

    private static SpanExporter configureExporter() {
        String exporterType = getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase();
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

    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "otel-shutdown-hook"));
    }

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

    public void flush() {
        if (isNoop || tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.forceFlush().join(10, TimeUnit.SECONDS);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error flushing spans", e);
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

    private static String getServiceName() {
        return getEnvOrProperty("SERVICE_NAME", getEnvOrProperty("OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME));
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
