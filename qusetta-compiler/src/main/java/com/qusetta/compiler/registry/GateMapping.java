/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * How one canonical gate is realised in one vocabulary.
 */
public sealed interface GateMapping permits GateMapping.Native, GateMapping.Decomposed {

    /**
     * The vocabulary has the gate under {@code primaryName}; {@code aliases} are also accepted
     * when decoding.
     */
    record Native(String primaryName, List<String> aliases) implements GateMapping {
        public Native {
            Objects.requireNonNull(primaryName, "Primary name cannot be null");
            if (primaryName.isBlank()) {
                throw new IllegalArgumentException("Primary name cannot be blank");
            }
            aliases = aliases == null ? List.of() : List.copyOf(aliases);
        }

        public List<String> allNames() {
            if (aliases.isEmpty()) return List.of(primaryName);
            List<String> names = new ArrayList<>(aliases.size() + 1);
            names.add(primaryName);
            names.addAll(aliases);
            return List.copyOf(names);
        }
    }

    /**
     * The vocabulary lacks the gate; it is rewritten through {@code template}.
     */
    record Decomposed(DecompositionTemplate template) implements GateMapping {
        public Decomposed {
            Objects.requireNonNull(template, "Template cannot be null");
        }
    }
}
