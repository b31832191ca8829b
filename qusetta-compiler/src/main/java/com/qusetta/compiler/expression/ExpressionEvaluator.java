/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.expression;

import com.qusetta.api.exceptions.ExpressionException;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Parses and evaluates the arithmetic angle expressions found in gate tokens.
 *
 * <p>Supported: numeric literals (integer or decimal, optional exponent), the constants
 * of {@link NamedConstant}, unary {@code +}/{@code -}, binary {@code + - * /}, exponentiation
 * ({@code ^} or {@code **}) and parentheses. Identifiers that are not constants are
 * variables and must be bound at evaluation time.
 *
 * <p>Stateless and thread-safe.
 */
public class ExpressionEvaluator {

    /**
     * Parses an expression without evaluating it.
     *
     * @throws ExpressionException if the text is empty or syntactically malformed
     */
    public Expression parse(String text) {
        Expression root = ExpressionParser.parse(text);
        return new Checked(text, root);
    }

    /**
     * Evaluates a closed expression (constants only, no variables).
     *
     * @throws ExpressionException if the text is malformed, references an unknown
     *         identifier, divides by zero or does not produce a finite value
     */
    public double evaluate(String text) {
        return parse(text).evaluate(Map.of());
    }

    /**
     * Evaluates an expression with the given variable bindings.
     */
    public double evaluate(String text, Map<String, Double> bindings) {
        return parse(text).evaluate(bindings);
    }

    /**
     * @return the free identifiers referenced by {@code expression}
     */
    public static Set<String> variablesOf(Expression expression) {
        Set<String> names = new HashSet<>();
        expression.collectVariables(names);
        return names;
    }

    /** Root wrapper that rejects non-finite results (overflow, 0^-1). */
    private record Checked(String source, Expression root) implements Expression {
        @Override
        public double evaluate(Map<String, Double> bindings) {
            double value = root.evaluate(bindings);
            if (!Double.isFinite(value)) {
                throw new ExpressionException("Expression does not evaluate to a finite number", source, 0);
            }
            return value;
        }

        @Override
        public void collectVariables(Set<String> names) {
            root.collectVariables(names);
        }
    }
}
