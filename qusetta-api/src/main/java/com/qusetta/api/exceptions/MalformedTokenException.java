/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.exceptions;

/**
 * Thrown when a gate token does not have the shape {@code NAME}, {@code NAME(qubits)}
 * or {@code NAME(params)(qubits)}.
 */
public class MalformedTokenException extends TranslationException {

    public MalformedTokenException(String message, String token) {
        super(message + ": '" + token + "'", token);
    }
}
