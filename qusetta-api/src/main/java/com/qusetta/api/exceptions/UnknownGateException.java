/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.exceptions;

/**
 * Thrown when a token names a gate that is not registered for the vocabulary being decoded.
 */
public class UnknownGateException extends TranslationException {

    private final String gateName;

    public UnknownGateException(String gateName, String vocabulary, String token) {
        super("Unknown gate '" + gateName + "' for vocabulary " + vocabulary + ": " + token, token);
        this.gateName = gateName;
    }

    public String gateName() {
        return gateName;
    }
}
