/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.exceptions;

/**
 * Thrown when a gate registry definition cannot be read or is structurally invalid.
 */
public class RegistryConfigurationException extends TranslationException {

    public RegistryConfigurationException(String message) {
        super(message);
    }

    public RegistryConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
