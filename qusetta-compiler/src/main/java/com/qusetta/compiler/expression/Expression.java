/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.expression;

import com.qusetta.api.exceptions.ExpressionException;

import java.util.Map;
import java.util.Set;

/**
 * A parsed angle expression. Instances are immutable and may be evaluated repeatedly,
 * from any thread, against different variable bindings.
 */
public interface Expression {

    /**
     * Evaluates the expression.
     *
     * @param bindings values for free identifiers (e.g. {@code p0}); constants need no binding
     * @return the value
     * @throws ExpressionException on an unbound identifier or an arithmetic failure
     */
    double evaluate(Map<String, Double> bindings);

    /**
     * Adds the names of all free identifiers of this expression to {@code names}.
     */
    void collectVariables(Set<String> names);

    record Literal(double value) implements Expression {
        @Override
        public double evaluate(Map<String, Double> bindings) {
            return value;
        }

        @Override
        public void collectVariables(Set<String> names) {
        }
    }

    record Constant(NamedConstant constant) implements Expression {
        @Override
        public double evaluate(Map<String, Double> bindings) {
            return constant.value();
        }

        @Override
        public void collectVariables(Set<String> names) {
        }
    }

    record Variable(String name, String source, int position) implements Expression {
        @Override
        public double evaluate(Map<String, Double> bindings) {
            Double value = bindings.get(name);
            if (value == null) {
                throw new ExpressionException("Unknown identifier '" + name + "'", source, position);
            }
            return value;
        }

        @Override
        public void collectVariables(Set<String> names) {
            names.add(name);
        }
    }

    record Negate(Expression operand) implements Expression {
        @Override
        public double evaluate(Map<String, Double> bindings) {
            return -operand.evaluate(bindings);
        }

        @Override
        public void collectVariables(Set<String> names) {
            operand.collectVariables(names);
        }
    }

    record Binary(char operator, Expression left, Expression right, String source, int position)
            implements Expression {
        @Override
        public double evaluate(Map<String, Double> bindings) {
            double l = left.evaluate(bindings);
            double r = right.evaluate(bindings);
            return switch (operator) {
                case '+' -> l + r;
                case '-' -> l - r;
                case '*' -> l * r;
                case '/' -> {
                    if (r == 0.0) {
                        throw new ExpressionException("Division by zero", source, position);
                    }
                    yield l / r;
                }
                case '^' -> Math.pow(l, r);
                default -> throw new IllegalStateException("Unexpected operator: " + operator);
            };
        }

        @Override
        public void collectVariables(Set<String> names) {
            left.collectVariables(names);
            right.collectVariables(names);
        }
    }
}
