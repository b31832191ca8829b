/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api;

import com.qusetta.api.model.Circuit;
import com.qusetta.api.model.GateInstruction;
import com.qusetta.api.model.Vocabulary;

import java.util.List;

/**
 * Converts between the textual gate-token form and {@link GateInstruction}.
 *
 * <p>Token grammar:
 * <pre>
 * token      := NAME | NAME "(" qubit-list ")" | NAME "(" param-list ")" "(" qubit-list ")"
 * param-list := expression ("," expression)*
 * qubit-list := integer-literal ("," integer-literal)*
 * </pre>
 */
public interface IGateTokenCodec {

    /**
     * Decodes a token written with canonical gate names.
     */
    GateInstruction decode(String token);

    /**
     * Decodes a token written with a vocabulary's native gate names and angle scale.
     * Qubit indices are returned as written; qubit conventions are applied by translation.
     */
    GateInstruction decode(String token, Vocabulary vocabulary);

    /**
     * Renders an instruction with its canonical gate name.
     */
    String encode(GateInstruction instruction);

    /**
     * Renders an instruction with the vocabulary's native gate name and angle scale.
     */
    String encode(GateInstruction instruction, Vocabulary vocabulary);

    /**
     * Decodes a whole circuit, skipping the vocabulary's dropped operations.
     */
    Circuit decodeCircuit(List<String> tokens, Vocabulary vocabulary);

    /**
     * Renders a whole circuit in the vocabulary's native names.
     */
    List<String> encodeCircuit(Circuit circuit, Vocabulary vocabulary);
}
