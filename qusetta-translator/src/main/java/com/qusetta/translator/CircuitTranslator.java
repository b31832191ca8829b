/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.translator;

import com.qusetta.api.ICircuitTranslator;
import com.qusetta.api.TranslationListener;
import com.qusetta.api.exceptions.UnsupportedGateException;
import com.qusetta.api.model.Circuit;
import com.qusetta.api.model.GateInstruction;
import com.qusetta.api.model.QubitConvention;
import com.qusetta.api.model.Vocabulary;
import com.qusetta.compiler.codec.GateTokenCodec;
import com.qusetta.compiler.registry.GateMapping;
import com.qusetta.compiler.registry.GateRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Translates circuits from one vocabulary to another through the canonical form.
 *
 * <p>Pipeline, one listener stage each:
 * <ol>
 *   <li>DECODE: native tokens to a circuit (token entry point only)</li>
 *   <li>SOURCE_REMAP: source qubit indices to canonical ones</li>
 *   <li>RESOLVE: every gate the target lacks is expanded through the registry's
 *       decompositions, recursively, until only target-native gates remain</li>
 *   <li>TARGET_REMAP: canonical qubit indices to the target's convention</li>
 *   <li>ENCODE: back to native tokens (token entry point only)</li>
 * </ol>
 *
 * <p>Instruction order is preserved and the expansion of one instruction stays contiguous.
 * Remapping uses the circuit's qubit count, so a circuit declared wider than the qubits it
 * touches is reversed over its declared width.
 *
 * <p>The first failure aborts the whole translation; no partial output is returned.
 */
public class CircuitTranslator implements ICircuitTranslator {
    private static final Logger logger = Logger.getLogger(CircuitTranslator.class.getName());

    public static final int DEFAULT_MAX_DECOMPOSITION_DEPTH = 16;

    static final String STAGE_DECODE = "DECODE";
    static final String STAGE_SOURCE_REMAP = "SOURCE_REMAP";
    static final String STAGE_RESOLVE = "RESOLVE";
    static final String STAGE_TARGET_REMAP = "TARGET_REMAP";
    static final String STAGE_ENCODE = "ENCODE";

    private final GateRegistry registry;
    private final GateTokenCodec codec;
    private final int maxDecompositionDepth;
    private Tracer tracer;
    private TranslationListener listener;

    public CircuitTranslator(GateRegistry registry, GateTokenCodec codec, int maxDecompositionDepth, Tracer tracer) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        if (maxDecompositionDepth < 1) {
            throw new IllegalArgumentException("maxDecompositionDepth must be positive: " + maxDecompositionDepth);
        }
        this.maxDecompositionDepth = maxDecompositionDepth;
        this.tracer = tracer != null ? tracer : OpenTelemetry.noop().getTracer("qusetta-translator");
    }

    public CircuitTranslator(GateRegistry registry, Tracer tracer) {
        this(registry, new GateTokenCodec(registry), DEFAULT_MAX_DECOMPOSITION_DEPTH, tracer);
    }

    public CircuitTranslator(GateRegistry registry) {
        this(registry, null);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    @Override
    public void setTranslationListener(TranslationListener listener) {
        this.listener = listener;
    }

    public GateRegistry getRegistry() {
        return registry;
    }

    public GateTokenCodec getCodec() {
        return codec;
    }

    // ==================== Entry points ====================

    @Override
    public Circuit translate(Circuit circuit, Vocabulary source, Vocabulary target) {
        Objects.requireNonNull(circuit, "circuit must not be null");
        return traced(source, target, span -> {
            span.setAttribute("sourceInstructionCount", circuit.size());
            return translateStages(circuit, source, target, 0, 3, span);
        });
    }

    @Override
    public List<String> translateTokens(List<String> tokens, Vocabulary source, Vocabulary target) {
        return translateTokens(tokens, source, target, 0);
    }

    /**
     * Token translation for a source circuit declared {@code declaredQubitCount} qubits wide.
     */
    public List<String> translateTokens(List<String> tokens, Vocabulary source, Vocabulary target,
                                        int declaredQubitCount) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        return traced(source, target, span -> {
            Circuit decoded = stage(STAGE_DECODE, 1, 5,
                    () -> codec.decodeCircuit(tokens, source, declaredQubitCount),
                    c -> Map.of("tokenCount", tokens.size(), "instructionCount", c.size()));
            span.setAttribute("sourceInstructionCount", decoded.size());

            Circuit translated = translateStages(decoded, source, target, 1, 5, span);

            return stage(STAGE_ENCODE, 5, 5,
                    () -> codec.encodeCircuit(translated, target),
                    encoded -> Map.of("tokenCount", encoded.size()));
        });
    }

    // ==================== Pipeline ====================

    private Circuit translateStages(Circuit circuit, Vocabulary source, Vocabulary target,
                                    int stageOffset, int totalStages, Span span) {
        int qubitCount = circuit.qubitCount();
        span.setAttribute("qubitCount", qubitCount);

        List<GateInstruction> canonical = stage(STAGE_SOURCE_REMAP, stageOffset + 1, totalStages,
                () -> remap(circuit.instructions(), source.qubitConvention(), qubitCount),
                list -> Map.of("instructionCount", list.size(), "convention", source.qubitConvention().name()));

        int[] decomposed = new int[1];
        List<GateInstruction> resolved = stage(STAGE_RESOLVE, stageOffset + 2, totalStages,
                () -> resolve(canonical, target, decomposed),
                list -> Map.of("instructionCount", list.size(), "decomposedInstructionCount", decomposed[0]));

        List<GateInstruction> remapped = stage(STAGE_TARGET_REMAP, stageOffset + 3, totalStages,
                () -> remap(resolved, target.qubitConvention(), qubitCount),
                list -> Map.of("instructionCount", list.size(), "convention", target.qubitConvention().name()));

        span.setAttribute("targetInstructionCount", remapped.size());
        span.setAttribute("decomposedInstructionCount", decomposed[0]);

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Translated %d instruction(s) on %d qubit(s) from %s to %s: "
                            + "%d decomposed, %d emitted",
                    circuit.size(), qubitCount, source.id(), target.id(), decomposed[0], remapped.size()));
        }
        return new Circuit(remapped, qubitCount);
    }

    /**
     * Both conventions are involutions, so the same mapping converts native to canonical
     * and canonical to native.
     */
    private static List<GateInstruction> remap(List<GateInstruction> instructions, QubitConvention convention,
                                               int qubitCount) {
        if (convention == QubitConvention.IDENTITY) {
            return instructions;
        }
        List<GateInstruction> out = new ArrayList<>(instructions.size());
        for (GateInstruction instruction : instructions) {
            out.add(instruction.mapQubits(q -> convention.remap(q, qubitCount)));
        }
        return out;
    }

    private List<GateInstruction> resolve(List<GateInstruction> instructions, Vocabulary target, int[] decomposed) {
        List<GateInstruction> out = new ArrayList<>(instructions.size());
        for (GateInstruction instruction : instructions) {
            int before = out.size();
            expand(instruction, target, 0, out);
            if (out.size() != before + 1 || out.get(before) != instruction) {
                decomposed[0]++;
            }
        }
        return out;
    }

    private void expand(GateInstruction instruction, Vocabulary target, int depth, List<GateInstruction> out) {
        GateMapping mapping = registry.mappingFor(instruction.gate(), target);
        if (mapping instanceof GateMapping.Native) {
            out.add(instruction);
            return;
        }
        if (depth >= maxDecompositionDepth) {
            throw new UnsupportedGateException(instruction.gate().gateName(), target.id(),
                    "Decomposing " + instruction.gate().gateName() + " for " + target.id()
                            + " exceeds the maximum depth of " + maxDecompositionDepth);
        }
        List<GateInstruction> steps = registry.decompose(instruction, target);
        if (logger.isLoggable(Level.FINER)) {
            logger.finer("Decomposed " + codec.encode(instruction) + " into " + steps.size() + " step(s) for " + target.id());
        }
        for (GateInstruction step : steps) {
            expand(step, target, depth + 1, out);
        }
    }

    // ==================== Instrumentation ====================

    @FunctionalInterface
    private interface SpanBody<T> {
        T run(Span span);
    }

    private <T> T traced(Vocabulary source, Vocabulary target, SpanBody<T> body) {
        Objects.requireNonNull(source, "source vocabulary must not be null");
        Objects.requireNonNull(target, "target vocabulary must not be null");
        Span span = tracer.spanBuilder("translate-circuit").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("source.vocabulary", source.id());
            span.setAttribute("target.vocabulary", target.id());
            registry.requireRegistered(source);
            registry.requireRegistered(target);
            return body.run(span);
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private <T> T stage(String name, int number, int total, Supplier<T> work,
                        Function<T, Map<String, Object>> metrics) {
        TranslationListener current = listener;
        if (current != null) {
            current.onStageStart(name, number, total);
        }
        long start = System.nanoTime();
        T result;
        try {
            result = work.get();
        } catch (RuntimeException e) {
            if (current != null) {
                current.onError(name, e);
            }
            throw e;
        }
        if (current != null) {
            current.onStageComplete(name,
                    new TranslationListener.StageResult(name, System.nanoTime() - start, metrics.apply(result)));
        }
        return result;
    }
}
