/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.codec;

import com.qusetta.api.IGateTokenCodec;
import com.qusetta.api.exceptions.ArityMismatchException;
import com.qusetta.api.exceptions.ExpressionException;
import com.qusetta.api.exceptions.InvalidQubitException;
import com.qusetta.api.exceptions.UnknownGateException;
import com.qusetta.api.exceptions.UnsupportedGateException;
import com.qusetta.api.model.CanonicalGate;
import com.qusetta.api.model.Circuit;
import com.qusetta.api.model.GateInstruction;
import com.qusetta.api.model.Vocabulary;
import com.qusetta.compiler.expression.ExpressionEvaluator;
import com.qusetta.compiler.registry.DecompositionTemplate;
import com.qusetta.compiler.registry.GateRegistry;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads and writes gate tokens such as {@code H(0)}, {@code CX(0, 2)} or {@code RX(PI/2)(1)}.
 *
 * <p>Decoding checks, in order: token structure, gate name, parameter and qubit counts,
 * qubit literals, parameter expressions, duplicate qubits. The first failure is thrown
 * with the offending token attached.
 *
 * <p>Encoding renders each parameter as the shortest plain decimal that parses back to
 * the same double, so {@code decode(encode(x))} reproduces {@code x}; symbolic input such
 * as {@code PI/2} is not preserved.
 *
 * <p>Thread-safe: holds only immutable collaborators.
 */
public class GateTokenCodec implements IGateTokenCodec {

    private static final Pattern QUBIT_LITERAL = Pattern.compile("\\d+");

    private final ExpressionEvaluator evaluator;
    private final GateRegistry registry;

    public GateTokenCodec(ExpressionEvaluator evaluator, GateRegistry registry) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public GateTokenCodec(GateRegistry registry) {
        this(new ExpressionEvaluator(), registry);
    }

    // ==================== Decoding ====================

    @Override
    public GateInstruction decode(String token) {
        TokenSyntax.Parts parts = TokenSyntax.parse(token);
        CanonicalGate gate = CanonicalGate.fromName(parts.name())
                .orElseThrow(() -> new UnknownGateException(parts.name(), "canonical", token));
        return build(gate, parts, token, 1.0);
    }

    @Override
    public GateInstruction decode(String token, Vocabulary vocabulary) {
        TokenSyntax.Parts parts = TokenSyntax.parse(token);
        return decodeParts(parts, token, vocabulary);
    }

    @Override
    public Circuit decodeCircuit(List<String> tokens, Vocabulary vocabulary) {
        return decodeCircuit(tokens, vocabulary, 0);
    }

    /**
     * Decodes a circuit whose framework declares its register width. The width matters
     * for vocabularies with reversed qubit ordering.
     */
    public Circuit decodeCircuit(List<String> tokens, Vocabulary vocabulary, int declaredQubitCount) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        List<GateInstruction> instructions = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            TokenSyntax.Parts parts = TokenSyntax.parse(token);
            if (registry.isDropped(parts.name(), vocabulary)) {
                continue;
            }
            instructions.add(decodeParts(parts, token, vocabulary));
        }
        return new Circuit(instructions, declaredQubitCount);
    }

    private GateInstruction decodeParts(TokenSyntax.Parts parts, String token, Vocabulary vocabulary) {
        CanonicalGate gate = registry.canonicalGateFor(parts.name(), vocabulary)
                .orElseThrow(() -> new UnknownGateException(parts.name(), vocabulary.id(), token));
        return build(gate, parts, token, vocabulary.angleScale());
    }

    private GateInstruction build(CanonicalGate gate, TokenSyntax.Parts parts, String token, double angleScale) {
        List<String> paramEntries = parts.parameterEntries();
        List<String> qubitEntries = parts.qubitEntries();

        if (paramEntries.size() != gate.parameterArity()) {
            throw new ArityMismatchException(parts.name() + " takes " + gate.parameterArity()
                    + " parameter(s), got " + paramEntries.size() + ": " + token, token);
        }
        if (qubitEntries.size() != gate.qubitArity()) {
            throw new ArityMismatchException(parts.name() + " acts on " + gate.qubitArity()
                    + " qubit(s), got " + qubitEntries.size() + ": " + token, token);
        }

        List<Integer> qubits = new ArrayList<>(qubitEntries.size());
        for (String entry : qubitEntries) {
            qubits.add(parseQubit(entry, token));
        }

        List<Double> params = new ArrayList<>(paramEntries.size());
        for (String entry : paramEntries) {
            double value;
            try {
                value = evaluator.evaluate(entry);
            } catch (ExpressionException e) {
                throw e.withToken(token);
            }
            params.add(value / angleScale);
        }

        Set<Integer> seen = new HashSet<>();
        for (Integer q : qubits) {
            if (!seen.add(q)) {
                throw new InvalidQubitException("Qubit " + q + " appears more than once: " + token, token);
            }
        }
        return new GateInstruction(gate, params, qubits);
    }

    private static int parseQubit(String entry, String token) {
        if (!QUBIT_LITERAL.matcher(entry).matches()) {
            throw new InvalidQubitException("Qubit '" + entry + "' is not a non-negative integer literal: "
                    + token, token);
        }
        try {
            return Integer.parseInt(entry);
        } catch (NumberFormatException e) {
            throw new InvalidQubitException("Qubit '" + entry + "' is out of range: " + token, token);
        }
    }

    /**
     * Parses one step of a decomposition of {@code owner}: qubit entries are operand slots and
     * parameters stay unevaluated expressions over {@code p0 ..}.
     *
     * @throws com.qusetta.api.exceptions.RegistryConfigurationException if the step does not fit {@code owner}
     */
    public DecompositionTemplate.Step decodeTemplate(String token, CanonicalGate owner) {
        return DecompositionTemplate.Step.parse(token, owner, evaluator);
    }

    // ==================== Encoding ====================

    @Override
    public String encode(GateInstruction instruction) {
        return format(instruction.gate().gateName(), instruction, 1.0);
    }

    @Override
    public String encode(GateInstruction instruction, Vocabulary vocabulary) {
        String nativeName = registry.nativeNameFor(instruction.gate(), vocabulary)
                .orElseThrow(() -> new UnsupportedGateException(instruction.gate().gateName(), vocabulary.id(),
                        instruction.gate().gateName() + " has no native name in " + vocabulary.id()));
        return format(nativeName, instruction, vocabulary.angleScale());
    }

    @Override
    public List<String> encodeCircuit(Circuit circuit, Vocabulary vocabulary) {
        List<String> tokens = new ArrayList<>(circuit.size());
        for (GateInstruction instruction : circuit) {
            tokens.add(encode(instruction, vocabulary));
        }
        return tokens;
    }

    private static String format(String name, GateInstruction instruction, double angleScale) {
        StringBuilder sb = new StringBuilder(name);
        if (!instruction.params().isEmpty()) {
            sb.append('(');
            for (int i = 0; i < instruction.params().size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(formatParameter(instruction.params().get(i) * angleScale));
            }
            sb.append(')');
        }
        if (!instruction.qubits().isEmpty()) {
            sb.append('(');
            for (int i = 0; i < instruction.qubits().size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(instruction.qubits().get(i));
            }
            sb.append(')');
        }
        return sb.toString();
    }

    /**
     * Shortest plain decimal that round-trips to {@code value}.
     */
    static String formatParameter(double value) {
        if (value == 0.0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
