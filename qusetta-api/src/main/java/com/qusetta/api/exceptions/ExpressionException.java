/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.api.exceptions;

/**
 * Thrown when an angle expression is malformed or cannot be evaluated
 * (unbalanced parentheses, unknown identifier, division by zero, trailing input).
 */
public class ExpressionException extends TranslationException {

    private final String expression;
    private final int position;

    public ExpressionException(String message, String expression, int position) {
        super(message + " at position " + position + " in '" + expression + "'");
        this.expression = expression;
        this.position = position;
    }

    private ExpressionException(String fullMessage, String expression, int position, String token, Throwable cause) {
        super(fullMessage, token, cause);
        this.expression = expression;
        this.position = position;
    }

    /**
     * Returns a copy of this exception attributed to the gate token the expression came from.
     */
    public ExpressionException withToken(String token) {
        return new ExpressionException(getMessage() + ": " + token, expression, position, token, this);
    }

    public String expression() {
        return expression;
    }

    /**
     * @return zero-based offset of the failure in {@link #expression()}
     */
    public int position() {
        return position;
    }
}
