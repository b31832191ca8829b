/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One external framework's gate-naming, qubit-ordering and angle convention.
 *
 * <p>Vocabularies are identified by their upper-case {@code id}; the native gate names
 * themselves are owned by the gate registry.
 *
 * @param id                 upper-case identifier, e.g. "QISKIT"
 * @param qubitConvention    how native qubit indices relate to canonical ones
 * @param angleScale         native angle = canonical angle * angleScale
 * @param droppedOperations  native operation names skipped while decoding (measurements)
 */
public record Vocabulary(
        String id,
        QubitConvention qubitConvention,
        double angleScale,
        Set<String> droppedOperations
) {

    public Vocabulary {
        Objects.requireNonNull(id, "Vocabulary id cannot be null");
        Objects.requireNonNull(qubitConvention, "Qubit convention cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Vocabulary id cannot be blank");
        }
        if (!Double.isFinite(angleScale) || angleScale == 0.0) {
            throw new IllegalArgumentException("Angle scale must be finite and non-zero, got " + angleScale);
        }
        id = id.trim().toUpperCase(Locale.ROOT);
        droppedOperations = droppedOperations == null ? Set.of() : Set.copyOf(droppedOperations);
    }

    public Vocabulary(String id, QubitConvention qubitConvention) {
        this(id, qubitConvention, 1.0, Set.of());
    }

    /**
     * Converts a canonical angle to this vocabulary's native scale.
     */
    public double toNativeAngle(double canonical) {
        return canonical * angleScale;
    }

    /**
     * Converts a native angle back to canonical scale.
     */
    public double toCanonicalAngle(double nativeAngle) {
        return nativeAngle / angleScale;
    }

    @Override
    public String toString() {
        return id;
    }
}
