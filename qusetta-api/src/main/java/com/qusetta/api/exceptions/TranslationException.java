/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.exceptions;

/**
 * Base class for every failure raised while decoding, translating or encoding a circuit.
 *
 * <p>Where a failure can be attributed to a single gate token, that token is available
 * through {@link #token()}.
 */
public class TranslationException extends RuntimeException {

    private final String token;

    public TranslationException(String message) {
        this(message, (String) null);
    }

    public TranslationException(String message, String token) {
        super(message);
        this.token = token;
    }

    public TranslationException(String message, String token, Throwable cause) {
        super(message, cause);
        this.token = token;
    }

    public TranslationException(String message, Throwable cause) {
        this(message, null, cause);
    }

    /**
     * @return the offending gate token, or null when the failure is not tied to one
     */
    public String token() {
        return token;
    }
}
