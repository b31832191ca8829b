/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.exceptions;

/**
 * Thrown when a canonical gate has neither a native mapping nor a usable decomposition
 * for a vocabulary. This indicates a defect in the gate registry, not bad input, and
 * is never recovered from: the translation that hit it produces no output.
 */
public class UnsupportedGateException extends TranslationException {

    private final String gateName;
    private final String vocabulary;

    public UnsupportedGateException(String gateName, String vocabulary, String message) {
        super(message);
        this.gateName = gateName;
        this.vocabulary = vocabulary;
    }

    public String gateName() {
        return gateName;
    }

    public String vocabulary() {
        return vocabulary;
    }
}
