/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.expression;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of named constants accepted in angle expressions.
 * Names are matched case-insensitively; the lexer also maps the Unicode {@code π} to {@link #PI}.
 */
public enum NamedConstant {
    PI(Math.PI),
    TAU(2 * Math.PI),
    E(Math.E);

    private final double value;

    NamedConstant(double value) {
        this.value = value;
    }

    public double value() {
        return value;
    }

    public static Optional<NamedConstant> lookup(String identifier) {
        if (identifier == null) return Optional.empty();
        try {
            return Optional.of(NamedConstant.valueOf(identifier.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
