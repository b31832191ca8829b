/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.model;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * An ordered, immutable sequence of gate instructions.
 *
 * <p>The qubit count is implicit: one plus the highest referenced index, or 0 for an
 * empty circuit. A framework that knows its register width can declare it through
 * {@code declaredQubitCount}; the effective count is the larger of the two. Circuits
 * carry no measurement semantics.
 *
 * @param instructions       the gates, in application order
 * @param declaredQubitCount explicit register width, or 0 if not declared
 */
public record Circuit(
        List<GateInstruction> instructions,
        int declaredQubitCount
) implements Iterable<GateInstruction> {

    public Circuit {
        instructions = List.copyOf(Objects.requireNonNull(instructions, "Instructions cannot be null"));
        if (declaredQubitCount < 0) {
            throw new IllegalArgumentException("Declared qubit count cannot be negative: " + declaredQubitCount);
        }
        int inferred = inferQubitCount(instructions);
        if (declaredQubitCount > 0 && declaredQubitCount < inferred) {
            throw new IllegalArgumentException("Declared qubit count " + declaredQubitCount
                    + " is smaller than the " + inferred + " qubits referenced");
        }
    }

    public Circuit(List<GateInstruction> instructions) {
        this(instructions, 0);
    }

    public static Circuit of(GateInstruction... instructions) {
        return new Circuit(List.of(instructions));
    }

    /**
     * @return the width of the circuit: {@code max(declaredQubitCount, 1 + highest index)}
     */
    public int qubitCount() {
        return Math.max(declaredQubitCount, inferQubitCount(instructions));
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public GateInstruction get(int index) {
        return instructions.get(index);
    }

    @Override
    public Iterator<GateInstruction> iterator() {
        return instructions.iterator();
    }

    private static int inferQubitCount(List<GateInstruction> instructions) {
        int max = -1;
        for (GateInstruction instruction : instructions) {
            max = Math.max(max, instruction.maxQubit());
        }
        return max + 1;
    }
}
