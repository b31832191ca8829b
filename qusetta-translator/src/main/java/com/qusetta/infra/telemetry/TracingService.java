/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide OpenTelemetry setup for translation spans.
 *
 * <p>Spans are batched to the logging exporter. Configuration via environment variables
 * (or system properties of the same name):
 * <ul>
 *   <li>OTEL_DISABLED: disable tracing entirely (default: false)</li>
 *   <li>OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default: 1.0)</li>
 *   <li>SERVICE_NAME / OTEL_SERVICE_NAME: service identifier (default: qusetta)</li>
 *   <li>SERVICE_VERSION / OTEL_SERVICE_VERSION: deployment version (default: unknown)</li>
 * </ul>
 * Any failure during setup falls back to a noop tracer.
 */
public class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.qusetta.translator";
    private static final String DEFAULT_SERVICE_NAME = "qusetta";
    private static final String DEFAULT_SAMPLING_RATIO = "1.0";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

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
            registerShutdownHook();
        }
    }

    /**
     * Singleton with double-checked locking.
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

    private static TracingService initialize() {
        try {
            if (isTracingDisabled()) {
                logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
                return createNoopInstance();
            }

            Sampler sampler = configureSampler();
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(Resource.getDefault().merge(Resource.create(Attributes.builder()
                            .put(SERVICE_NAME, getServiceName())
                            .put(SERVICE_VERSION, getServiceVersion())
                            .build())))
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(LoggingSpanExporter.create())
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .build())
                    .build();

            // Not registered as GlobalOpenTelemetry.
            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format("OpenTelemetry initialized: service=%s, version=%s, sampler=%s",
                    getServiceName(), getServiceVersion(), sampler.getDescription()));

            return new TracingService(sdk, sdk.getTracer(INSTRUMENTATION_NAME), tracerProvider, false);

        } catch (Exception e) {
            logger.log(Level.WARNING, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return createNoopInstance();
        }
    }

    private static TracingService createNoopInstance() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new TracingService(noop, noop.getTracer(INSTRUMENTATION_NAME), null, true);
    }

    private static Sampler configureSampler() {
        String ratioText = getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", DEFAULT_SAMPLING_RATIO);
        double ratio;
        try {
            ratio = Math.max(0.0, Math.min(1.0, Double.parseDouble(ratioText)));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO: " + ratioText + ", using default");
            ratio = Double.parseDouble(DEFAULT_SAMPLING_RATIO);
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(ratio)).build();
    }

    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down OpenTelemetry...");
            shutdown();
        }, "otel-shutdown-hook"));
    }

    public void shutdown() {
        if (isNoop || tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
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

    // ==================== Public API ====================

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return !isNoop;
    }

    // ==================== Configuration Helpers ====================

    private static boolean isTracingDisabled() {
        return Boolean.parseBoolean(getEnvOrProperty("OTEL_DISABLED", "false"));
    }

    private static String getServiceName() {
        return getEnvOrProperty("SERVICE_NAME", getEnvOrProperty("OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME));
    }

    private static String getServiceVersion() {
        return getEnvOrProperty("SERVICE_VERSION", getEnvOrProperty("OTEL_SERVICE_VERSION", "unknown"));
    }

    private static String getEnvOrProperty(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key, defaultValue);
        }
        return value;
    }
}
