/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.model;

import com.qusetta.api.exceptions.ArityMismatchException;
import com.qusetta.api.exceptions.InvalidQubitException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.IntUnaryOperator;

/**
 * One gate application: a canonical gate, its real parameters and the qubits it acts on.
 *
 * <p>Immutable. The constructor enforces the catalog invariants, so no instance can exist
 * whose parameter or qubit count disagrees with {@link CanonicalGate}, or that repeats a
 * qubit. Qubit order is significant (controls before targets).
 *
 * @param gate   the canonical gate
 * @param params angles in radians, canonical scale; length = {@code gate.parameterArity()}
 * @param qubits qubit indices; length = {@code gate.qubitArity()}, non-negative, distinct
 */
public record GateInstruction(
        CanonicalGate gate,
        List<Double> params,
        List<Integer> qubits
) {

    public GateInstruction {
        Objects.requireNonNull(gate, "Gate cannot be null");
        params = List.copyOf(Objects.requireNonNull(params, "Params cannot be null"));
        qubits = List.copyOf(Objects.requireNonNull(qubits, "Qubits cannot be null"));

        if (params.size() != gate.parameterArity()) {
            throw new ArityMismatchException(gate.gateName() + " takes " + gate.parameterArity()
                    + " parameter(s), got " + params.size());
        }
        if (qubits.size() != gate.qubitArity()) {
            throw new ArityMismatchException(gate.gateName() + " acts on " + gate.qubitArity()
                    + " qubit(s), got " + qubits.size());
        }
        List<Double> normalized = new ArrayList<>(params.size());
        for (Double p : params) {
            if (!Double.isFinite(p)) {
                throw new IllegalArgumentException(gate.gateName() + " parameter must be finite, got " + p);
            }
            // store -0.0 as +0.0, the form the codec decodes back
            normalized.add(p == 0.0 ? 0.0 : p);
        }
        params = List.copyOf(normalized);
        Set<Integer> seen = new HashSet<>();
        for (Integer q : qubits) {
            if (q < 0) {
                throw new InvalidQubitException(gate.gateName() + " has negative qubit index " + q);
            }
            if (!seen.add(q)) {
                throw new InvalidQubitException(gate.gateName() + " repeats qubit " + q);
            }
        }
    }

    /**
     * Convenience factory for parameter-free gates.
     */
    public static GateInstruction of(CanonicalGate gate, int... qubits) {
        return new GateInstruction(gate, List.of(), boxed(qubits));
    }

    /**
     * Convenience factory for single-parameter gates.
     */
    public static GateInstruction of(CanonicalGate gate, double param, int... qubits) {
        return new GateInstruction(gate, List.of(param), boxed(qubits));
    }

    /**
     * @return the highest qubit index this instruction touches
     */
    public int maxQubit() {
        int max = -1;
        for (int q : qubits) {
            max = Math.max(max, q);
        }
        return max;
    }

    /**
     * Returns a copy with every qubit index passed through {@code mapping}.
     */
    public GateInstruction mapQubits(IntUnaryOperator mapping) {
        List<Integer> mapped = new ArrayList<>(qubits.size());
        for (int q : qubits) {
            mapped.add(mapping.applyAsInt(q));
        }
        return new GateInstruction(gate, params, mapped);
    }

    private static List<Integer> boxed(int[] values) {
        List<Integer> list = new ArrayList<>(values.length);
        for (int v : values) {
            list.add(v);
        }
        return list;
    }
}
