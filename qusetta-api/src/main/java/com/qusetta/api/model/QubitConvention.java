/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.model;

import java.util.Locale;

/**
 * How a vocabulary numbers qubits relative to the canonical ordering.
 *
 * <p>The remap is a circuit-wide operation: {@code totalQubits} must be the width of
 * the whole circuit, never of a single instruction, because reversal depends on it.
 * Both conventions are involutions for a fixed width.
 */
public enum QubitConvention {
    /** Vocabulary indices equal canonical indices. */
    IDENTITY {
        @Override
        int apply(int index, int totalQubits) {
            return index;
        }
    },
    /** Vocabulary index {@code i} is canonical index {@code totalQubits - 1 - i}. */
    REVERSED {
        @Override
        int apply(int index, int totalQubits) {
            return totalQubits - 1 - index;
        }
    };

    abstract int apply(int index, int totalQubits);

    /**
     * Maps a qubit index between this convention and the canonical one.
     *
     * @param index       qubit index, in {@code [0, totalQubits)}
     * @param totalQubits width of the circuit the index belongs to
     * @return the remapped index
     * @throws IllegalArgumentException if the index lies outside the circuit
     */
    public int remap(int index, int totalQubits) {
        if (index < 0 || index >= totalQubits) {
            throw new IllegalArgumentException(
                    "Qubit index " + index + " outside circuit of " + totalQubits + " qubits");
        }
        return apply(index, totalQubits);
    }

    /**
     * Lenient lookup used by configuration loading.
     *
     * @return the matching convention, or null if the text names none
     */
    public static QubitConvention fromString(String text) {
        if (text == null) return null;
        try {
            return QubitConvention.valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
