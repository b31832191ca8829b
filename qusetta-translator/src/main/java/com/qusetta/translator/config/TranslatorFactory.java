/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.translator.config;

import com.qusetta.compiler.codec.GateTokenCodec;
import com.qusetta.compiler.expression.ExpressionEvaluator;
import com.qusetta.compiler.registry.GateRegistry;
import com.qusetta.compiler.registry.GateRegistryLoader;
import com.qusetta.infra.telemetry.TracingService;
import com.qusetta.translator.CircuitTranslator;
import io.opentelemetry.api.trace.Tracer;

import java.util.logging.Logger;

/**
 * Wires registry, codec and translator from a {@link TranslatorConfig}.
 *
 * <pre>{@code
 * CircuitTranslator translator = TranslatorFactory.create(TranslatorConfig.fromEnvironment());
 * GateRegistry registry = translator.getRegistry();
 * List<String> qiskit = translator.translateTokens(cirqTokens,
 *         registry.vocabulary("CIRQ"), registry.vocabulary("QISKIT"));
 * }</pre>
 */
public final class TranslatorFactory {

    private static final Logger logger = Logger.getLogger(TranslatorFactory.class.getName());

    private TranslatorFactory() {
        throw new AssertionError("TranslatorFactory should not be instantiated");
    }

    /**
     * Uses the process-wide tracer from {@link TracingService}.
     */
    public static CircuitTranslator create(TranslatorConfig config) {
        return create(config, TracingService.getInstance().getTracer());
    }

    /**
     * @throws com.qusetta.api.exceptions.RegistryConfigurationException if the registry cannot be loaded
     * @throws com.qusetta.api.exceptions.UnsupportedGateException if validation is on and the registry has a gap
     */
    public static CircuitTranslator create(TranslatorConfig config, Tracer tracer) {
        logger.info("Creating translator: " + config);

        ExpressionEvaluator evaluator = new ExpressionEvaluator();
        GateRegistry registry = loadRegistry(config, evaluator);
        GateTokenCodec codec = new GateTokenCodec(evaluator, registry);
        return new CircuitTranslator(registry, codec, config.getMaxDecompositionDepth(), tracer);
    }

    private static GateRegistry loadRegistry(TranslatorConfig config, ExpressionEvaluator evaluator) {
        if (config.getRegistryPath().isEmpty()) {
            // standard() validates on first load
            return GateRegistry.standard();
        }
        GateRegistry registry = new GateRegistryLoader(evaluator).load(config.getRegistryPath().get());
        if (config.isValidateRegistry()) {
            registry.validateCompleteness();
        } else {
            logger.warning("Registry completeness check disabled; unmapped gates fail at translation time");
        }
        return registry;
    }
}
