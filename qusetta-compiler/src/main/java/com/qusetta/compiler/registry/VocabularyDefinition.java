/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.registry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON representation of one vocabulary in a gate registry file.
 * Only used while loading; {@link GateRegistryLoader} turns it into registry entries.
 */
public record VocabularyDefinition(
        @JsonProperty("vocabulary") String vocabulary,
        @JsonProperty("qubit_convention") String qubitConvention,
        @JsonProperty("angle_scale") Double angleScale,
        @JsonProperty("dropped_operations") List<String> droppedOperations,
        @JsonProperty("native_gates") Map<String, List<String>> nativeGates,
        @JsonProperty("decompositions") Map<String, List<String>> decompositions
) {
    // Default values for optional fields

    public String qubitConvention() {
        return qubitConvention != null ? qubitConvention : "IDENTITY";
    }

    public Double angleScale() {
        return angleScale != null ? angleScale : 1.0;
    }

    public List<String> droppedOperations() {
        return droppedOperations != null ? droppedOperations : List.of();
    }

    public Map<String, List<String>> nativeGates() {
        return nativeGates != null ? nativeGates : Map.of();
    }

    public Map<String, List<String>> decompositions() {
        return decompositions != null ? decompositions : Map.of();
    }
}
