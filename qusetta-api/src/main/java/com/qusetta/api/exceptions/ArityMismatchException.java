/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.exceptions;

/**
 * Thrown when the number of parameters or qubits does not match the gate's declared arity.
 */
public class ArityMismatchException extends TranslationException {

    public ArityMismatchException(String message) {
        super(message);
    }

    public ArityMismatchException(String message, String token) {
        super(message, token);
    }
}
