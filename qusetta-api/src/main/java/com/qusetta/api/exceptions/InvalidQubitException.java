/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.exceptions;

/**
 * Thrown for a qubit entry that is not a non-negative integer literal, or for a qubit
 * index that appears more than once in a single instruction.
 */
public class InvalidQubitException extends TranslationException {

    public InvalidQubitException(String message) {
        super(message);
    }

    public InvalidQubitException(String message, String token) {
        super(message, token);
    }
}
