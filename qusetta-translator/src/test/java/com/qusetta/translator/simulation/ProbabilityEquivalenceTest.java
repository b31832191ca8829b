/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.translator.simulation;

import com.qusetta.api.model.Circuit;
import com.qusetta.api.model.GateInstruction;
import com.qusetta.api.model.Vocabulary;
import com.qusetta.compiler.codec.GateTokenCodec;
import com.qusetta.compiler.registry.GateRegistry;
import com.qusetta.translator.CircuitTranslator;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Translated circuits may differ in global phase and exact gates, but must produce the same
 * measurement distribution.
 */
class ProbabilityEquivalenceTest {

    private static final double TOLERANCE = 1e-9;

    /** One circuit written by hand in every vocabulary. */
    private static final Map<String, List<String>> MIXED_CIRCUIT = Map.of(
            "QUSETTA", List.of(
                    "H(0)", "H(1)", "CX(0, 1)", "CX(1, 0)", "CZ(2, 0)",
                    "I(1)", "SWAP(0, 3)", "RY(PI)(1)", "X(2)", "S(0)",
                    "Z(2)", "Y(3)", "RX(0.4*PI)(0)", "T(2)", "RZ(-0.3*PI)(2)",
                    "CCX(0, 1, 2)"),
            "CIRQ", List.of(
                    "H(0)", "H(1)", "CNOT(0, 1)", "CNOT(1, 0)", "CZ(2, 0)",
                    "I(1)", "SWAP(0, 3)", "ry(PI)(1)", "X(2)", "S(0)",
                    "Z(2)", "Y(3)", "rx(0.4*PI)(0)", "T(2)", "rz(-0.3*PI)(2)",
                    "TOFFOLI(0, 1, 2)"),
            "QISKIT", List.of(
                    "h(3)", "h(2)", "cx(3, 2)", "cx(2, 3)", "cz(1, 3)",
                    "id(2)", "swap(3, 0)", "ry(PI)(2)", "x(1)", "s(3)",
                    "z(1)", "y(0)", "rx(0.4*PI)(3)", "t(1)", "rz(-0.3*PI)(1)",
                    "ccx(3, 2, 1)"),
            "QUASAR", List.of(
                    "H(0)", "H(1)", "CX(0, 1)", "CX(1, 0)", "CZ(2, 0)",
                    "I(1)", "SWAP(0, 3)", "Ry(PI/2)(1)", "X(2)", "S(0)",
                    "Z(2)", "Y(3)", "Rx(0.2*PI)(0)", "T(2)", "Rz(-0.15*PI)(2)",
                    "CCX(0, 1, 2)"));

    /** Exercises u1/u2/u3, which only the canonical and Qiskit vocabularies have natively. */
    private static final List<String> QISKIT_U_GATES = List.of(
            "h(0)", "h(2)", "u1(PI/6)(1)", "u2(1, 2)(0)", "ccx(1, 0, 3)", "ccx(0, 1, 2)",
            "u3(1, 2, 3)(1)", "rx(PI/3)(1)", "u3(1.56, 1.24, 1.69)(2)", "u2(1.2, 5.1)(1)",
            "u1(6.542)(0)");

    /** Gates that several vocabularies must decompose. */
    private static final List<String> CANONICAL_DECOMPOSED = List.of(
            "H(0)", "RY(0.7)(1)", "H(2)", "SDG(0)", "TDG(1)", "CY(0, 2)", "CRZ(1.3)(2, 1)",
            "U3(0.3, 1.1, -0.4)(0)", "U2(0.2, 0.9)(1)", "U1(2.2)(2)", "CSWAP(1, 0, 2)", "RX(0.5)(2)");

    private static GateRegistry registry;
    private static GateTokenCodec codec;
    private static CircuitTranslator translator;

    @BeforeAll
    static void setUp() {
        registry = GateRegistry.standard();
        codec = new GateTokenCodec(registry);
        translator = new CircuitTranslator(registry, OpenTelemetry.noop().getTracer("test"));
    }

    private static double[] simulate(List<String> tokens, Vocabulary vocabulary, int qubitCount) {
        Circuit circuit = codec.decodeCircuit(tokens, vocabulary, qubitCount);
        return StateVectorSimulator.probabilities(circuit, vocabulary.qubitConvention());
    }

    private static void assertSameDistribution(double[] actual, double[] expected) {
        assertThat(actual).hasSameSizeAs(expected);
        for (int i = 0; i < expected.length; i++) {
            assertThat(actual[i]).as("probability of basis state %d", i).isCloseTo(expected[i], within(TOLERANCE));
        }
    }

    static Stream<String> vocabularyIds() {
        return Stream.of("QUSETTA", "CIRQ", "QISKIT", "QUASAR");
    }

    static Stream<Arguments> vocabularyPairs() {
        List<String> ids = vocabularyIds().toList();
        List<Arguments> pairs = new ArrayList<>();
        for (String source : ids) {
            for (String target : ids) {
                pairs.add(Arguments.of(source, target));
            }
        }
        return pairs.stream();
    }

    @Test
    @DisplayName("Hand-written versions of the same circuit agree in every vocabulary")
    void handWrittenCircuitsAgree() {
        double[] reference = simulate(MIXED_CIRCUIT.get("QUSETTA"), registry.vocabulary("QUSETTA"), 4);

        for (String id : List.of("CIRQ", "QISKIT", "QUASAR")) {
            assertSameDistribution(simulate(MIXED_CIRCUIT.get(id), registry.vocabulary(id), 4), reference);
        }
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("vocabularyPairs")
    @DisplayName("Translation preserves the distribution of the mixed circuit")
    void mixedCircuitTranslates(String sourceId, String targetId) {
        Vocabulary source = registry.vocabulary(sourceId);
        Vocabulary target = registry.vocabulary(targetId);
        List<String> tokens = MIXED_CIRCUIT.get(sourceId);

        List<String> translated = translator.translateTokens(tokens, source, target);

        assertSameDistribution(simulate(translated, target, 4), simulate(tokens, source, 4));
        assertSameDistribution(simulate(translated, target, 4), simulate(MIXED_CIRCUIT.get(targetId), target, 4));
    }

    @ParameterizedTest(name = "QISKIT -> {0}")
    @MethodSource("vocabularyIds")
    @DisplayName("Translation preserves the distribution of u-gate circuits")
    void uGateCircuitTranslates(String targetId) {
        Vocabulary qiskit = registry.vocabulary("QISKIT");
        Vocabulary target = registry.vocabulary(targetId);

        List<String> translated = translator.translateTokens(QISKIT_U_GATES, qiskit, target);

        assertSameDistribution(simulate(translated, target, 4), simulate(QISKIT_U_GATES, qiskit, 4));
    }

    @ParameterizedTest(name = "{0} -> {1} -> {0}")
    @MethodSource("vocabularyPairs")
    @DisplayName("Round trips through any vocabulary preserve the distribution")
    void roundTripPreservesDistribution(String viaId, String targetId) {
        Vocabulary canonical = registry.vocabulary("QUSETTA");
        Vocabulary via = registry.vocabulary(viaId);
        Vocabulary target = registry.vocabulary(targetId);

        List<String> first = translator.translateTokens(CANONICAL_DECOMPOSED, canonical, via);
        List<String> second = translator.translateTokens(first, via, target);
        List<String> back = translator.translateTokens(second, target, canonical);

        double[] expected = simulate(CANONICAL_DECOMPOSED, canonical, 3);
        assertSameDistribution(simulate(first, via, 3), expected);
        assertSameDistribution(simulate(second, target, 3), expected);
        assertSameDistribution(simulate(back, canonical, 3), expected);
    }

    @ParameterizedTest(name = "{0} -> {1} -> {0}")
    @MethodSource("vocabularyPairs")
    @DisplayName("Round trips keep every gate, its qubits and its parameters")
    void roundTripPreservesInstructions(String originId, String viaId) {
        Vocabulary origin = registry.vocabulary(originId);
        Vocabulary via = registry.vocabulary(viaId);
        List<String> tokens = MIXED_CIRCUIT.get(originId);

        List<String> back = translator.translateTokens(translator.translateTokens(tokens, origin, via), via, origin);

        List<GateInstruction> expected = codec.decodeCircuit(tokens, origin).instructions();
        List<GateInstruction> actual = codec.decodeCircuit(back, origin).instructions();
        assertThat(actual).hasSameSizeAs(expected);
        for (int i = 0; i < expected.size(); i++) {
            GateInstruction want = expected.get(i);
            GateInstruction got = actual.get(i);
            assertThat(got.gate()).as("gate of instruction %d", i).isEqualTo(want.gate());
            assertThat(got.qubits()).as("qubits of instruction %d", i).isEqualTo(want.qubits());
            assertThat(got.params()).as("parameters of instruction %d", i).hasSameSizeAs(want.params());
            for (int p = 0; p < want.params().size(); p++) {
                assertThat(got.params().get(p)).isCloseTo(want.params().get(p), within(TOLERANCE));
            }
        }
    }

    @Test
    @DisplayName("Measurements are dropped without changing the distribution")
    void measurementIsIgnored() {
        Vocabulary cirq = registry.vocabulary("CIRQ");
        Vocabulary qiskit = registry.vocabulary("QISKIT");

        List<String> translated = translator.translateTokens(List.of("h(0)", "measure(0)"), qiskit, cirq);

        assertThat(translated).containsExactly("H(0)");
    }
}
