/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.registry;

import com.qusetta.api.exceptions.RegistryConfigurationException;
import com.qusetta.api.model.CanonicalGate;
import com.qusetta.api.model.QubitConvention;
import com.qusetta.api.model.Vocabulary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GateRegistryLoaderTest {

    @TempDir
    Path tempDir;

    private GateRegistryLoader loader;

    @BeforeEach
    void setUp() {
        loader = new GateRegistryLoader();
    }

    private Path writeRegistry(String json) throws IOException {
        Path file = tempDir.resolve("registry.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    @DisplayName("Should load a small registry from a file")
    void shouldLoadFromFile() throws IOException {
        Path file = writeRegistry("""
                [
                  {
                    "vocabulary": "toy",
                    "qubit_convention": "reversed",
                    "angle_scale": 2.0,
                    "dropped_operations": ["MEASURE"],
                    "native_gates": { "H": ["had"], "CX": ["cnot", "cx"], "RZ": ["rz"] },
                    "decompositions": { "Z": ["RZ(PI)(0)"] }
                  }
                ]
                """);

        GateRegistry registry = loader.load(file);
        Vocabulary toy = registry.vocabulary("TOY");

        assertThat(toy.qubitConvention()).isEqualTo(QubitConvention.REVERSED);
        assertThat(toy.angleScale()).isEqualTo(2.0);
        assertThat(registry.canonicalGateFor("cx", toy)).contains(CanonicalGate.CX);
        assertThat(registry.nativeNameFor(CanonicalGate.CX, toy)).contains("cnot");
        assertThat(registry.decompositionFor(CanonicalGate.Z, toy)).isPresent();
        assertThat(registry.isDropped("measure", toy)).isTrue();
    }

    @Test
    @DisplayName("Optional fields fall back to defaults")
    void shouldApplyDefaults() throws IOException {
        GateRegistry registry = loader.load(writeRegistry("""
                [ { "vocabulary": "bare", "native_gates": { "X": ["x"] } } ]
                """));
        Vocabulary bare = registry.vocabulary("BARE");

        assertThat(bare.qubitConvention()).isEqualTo(QubitConvention.IDENTITY);
        assertThat(bare.angleScale()).isEqualTo(1.0);
        assertThat(bare.droppedOperations()).isEmpty();
    }

    @Test
    @DisplayName("Should load from a stream")
    void shouldLoadFromStream() {
        String json = "[ { \"vocabulary\": \"S\", \"native_gates\": { \"H\": [\"H\"] } } ]";

        GateRegistry registry = loader.load(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");

        assertThat(registry.vocabularies()).hasSize(1);
    }

    @Test
    @DisplayName("Should throw exception for empty definitions")
    void shouldThrowForEmpty() throws IOException {
        Path file = writeRegistry("[]");
        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(RegistryConfigurationException.class)
                .hasMessageContaining("definitions cannot be empty");
    }

    @Test
    @DisplayName("Should throw exception for missing vocabulary id")
    void shouldThrowForMissingId() throws IOException {
        Path file = writeRegistry("[ { \"native_gates\": { \"H\": [\"H\"] } } ]");
        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(RegistryConfigurationException.class)
                .hasMessageContaining("index 0 has missing or empty vocabulary");
    }

    @Test
    @DisplayName("Should throw exception for duplicate vocabulary")
    void shouldThrowForDuplicate() throws IOException {
        Path file = writeRegistry("[ { \"vocabulary\": \"A\" }, { \"vocabulary\": \"a\" } ]");
        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(RegistryConfigurationException.class)
                .hasMessageContaining("Duplicate vocabulary: A");
    }

    @Test
    @DisplayName("Should throw exception for unknown convention and gate")
    void shouldThrowForUnknownNames() throws IOException {
        Path conventionFile = writeRegistry("[ { \"vocabulary\": \"A\", \"qubit_convention\": \"SIDEWAYS\" } ]");
        assertThatThrownBy(() -> loader.load(conventionFile))
                .isInstanceOf(RegistryConfigurationException.class)
                .hasMessageContaining("unknown qubit_convention: SIDEWAYS");

        Path gateFile = writeRegistry("[ { \"vocabulary\": \"A\", \"native_gates\": { \"ISWAP\": [\"iswap\"] } } ]");
        assertThatThrownBy(() -> loader.load(gateFile))
                .isInstanceOf(RegistryConfigurationException.class)
                .hasMessageContaining("maps unknown gate: ISWAP");
    }

    @Test
    @DisplayName("Should throw exception for a gate both native and decomposed")
    void shouldThrowForDoubleMapping() throws IOException {
        Path file = writeRegistry("""
                [ { "vocabulary": "A",
                    "native_gates": { "Z": ["z"] },
                    "decompositions": { "Z": ["S(0)", "S(0)"] } } ]
                """);
        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(RegistryConfigurationException.class)
                .hasMessageContaining("both natively and through a decomposition");
    }

    @Test
    @DisplayName("Should throw exception for zero angle scale and empty names")
    void shouldThrowForBadValues() throws IOException {
        Path scaleFile = writeRegistry("[ { \"vocabulary\": \"A\", \"angle_scale\": 0 } ]");
        assertThatThrownBy(() -> loader.load(scaleFile))
                .isInstanceOf(RegistryConfigurationException.class)
                .hasMessageContaining("angle_scale");

        Path namesFile = writeRegistry("[ { \"vocabulary\": \"A\", \"native_gates\": { \"H\": [] } } ]");
        assertThatThrownBy(() -> loader.load(namesFile))
                .isInstanceOf(RegistryConfigurationException.class)
                .hasMessageContaining("has no names");
    }

    @Test
    @DisplayName("Should wrap malformed JSON and unknown fields")
    void shouldWrapJsonErrors() throws IOException {
        Path broken = writeRegistry("[ { \"vocabulary\": ");
        assertThatThrownBy(() -> loader.load(broken))
                .isInstanceOf(RegistryConfigurationException.class)
                .hasMessageContaining("Malformed gate registry");

        Path unknownField = writeRegistry("[ { \"vocabulary\": \"A\", \"colour\": \"blue\" } ]");
        assertThatThrownBy(() -> loader.load(unknownField))
                .isInstanceOf(RegistryConfigurationException.class);
    }

    @Test
    @DisplayName("Should wrap I/O failures with the cause")
    void shouldWrapIoFailures() {
        Path missing = tempDir.resolve("missing.json");
        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(RegistryConfigurationException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
