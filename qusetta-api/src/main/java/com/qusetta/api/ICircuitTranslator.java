/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api;

import com.qusetta.api.model.Circuit;
import com.qusetta.api.model.Vocabulary;

import io.opentelemetry.api.trace.Tracer;
import java.util.List;

/**
 * Contract for translating circuits from one gate vocabulary to another.
 */
public interface ICircuitTranslator {

    /**
     * Translates a decoded circuit.
     *
     * @param circuit the circuit, indexed in the source vocabulary's qubit convention
     * @param source  vocabulary the circuit was decoded from
     * @param target  vocabulary to express the circuit in
     * @return an equivalent circuit whose gates are all native to {@code target},
     *         indexed in the target's qubit convention
     * @throws com.qusetta.api.exceptions.UnsupportedGateException if the registry cannot
     *         express some gate in the target vocabulary
     */
    Circuit translate(Circuit circuit, Vocabulary source, Vocabulary target);

    /**
     * Decodes, translates and encodes a circuit given as native gate tokens.
     *
     * @param tokens native tokens of the source vocabulary, in order
     * @param source vocabulary of {@code tokens}
     * @param target vocabulary of the result
     * @return native tokens of the target vocabulary
     * @throws com.qusetta.api.exceptions.TranslationException on the first failing token or gate
     */
    List<String> translateTokens(List<String> tokens, Vocabulary source, Vocabulary target);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a listener for tracking translation stages.
     *
     * @param listener the translation listener (null to disable)
     */
    default void setTranslationListener(TranslationListener listener) {
    }
}
