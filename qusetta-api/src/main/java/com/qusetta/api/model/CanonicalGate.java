/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed catalog of gate kinds understood by the translator.
 *
 * <p>Each constant carries its registered token name and its declared arities. These
 * arities are the single source of truth: every {@link GateInstruction} is checked
 * against them on construction.
 *
 * <p>For controlled gates the control qubits come first, targets last
 * ({@code CX(control, target)}, {@code CCX(c0, c1, target)}, {@code CSWAP(control, a, b)}).
 */
public enum CanonicalGate {
    I("I", 1, 0),
    X("X", 1, 0),
    Y("Y", 1, 0),
    Z("Z", 1, 0),
    H("H", 1, 0),
    S("S", 1, 0),
    SDG("SDG", 1, 0),
    T("T", 1, 0),
    TDG("TDG", 1, 0),
    RX("RX", 1, 1),
    RY("RY", 1, 1),
    RZ("RZ", 1, 1),
    /** Phase gate diag(1, e^{i lambda}). */
    U1("U1", 1, 1),
    /** U2(phi, lambda) = U3(pi/2, phi, lambda). */
    U2("U2", 1, 2),
    /** General single-qubit rotation U3(theta, phi, lambda). */
    U3("U3", 1, 3),
    CX("CX", 2, 0),
    CY("CY", 2, 0),
    CZ("CZ", 2, 0),
    CRZ("CRZ", 2, 1),
    SWAP("SWAP", 2, 0),
    CCX("CCX", 3, 0),
    CSWAP("CSWAP", 3, 0);

    private static final Map<String, CanonicalGate> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(CanonicalGate::gateName, Function.identity()));

    private final String gateName;
    private final int qubitArity;
    private final int parameterArity;

    CanonicalGate(String gateName, int qubitArity, int parameterArity) {
        this.gateName = gateName;
        this.qubitArity = qubitArity;
        this.parameterArity = parameterArity;
    }

    /**
     * Looks up a gate by its registered name. Matching is exact and case-sensitive.
     *
     * @param name the token name (e.g. "CX")
     * @return the gate, or empty if no gate is registered under that name
     */
    public static Optional<CanonicalGate> fromName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public String gateName() {
        return gateName;
    }

    public int qubitArity() {
        return qubitArity;
    }

    public int parameterArity() {
        return parameterArity;
    }

    public boolean isParameterized() {
        return parameterArity > 0;
    }
}
