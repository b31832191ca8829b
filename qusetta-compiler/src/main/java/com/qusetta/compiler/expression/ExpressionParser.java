/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.expression;

import com.qusetta.api.exceptions.ExpressionException;

import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for angle expressions.
 *
 * <pre>
 * expression := term (("+" | "-") term)*
 * term       := unary (("*" | "/") unary)*
 * unary      := ("-" | "+") unary | power
 * power      := primary ("^" unary)?
 * primary    := NUMBER | IDENTIFIER | "(" expression ")"
 * </pre>
 * Exponentiation is right-associative and binds tighter than unary minus on its left,
 * so {@code -2^2} is {@code -4}.
 */
final class ExpressionParser {

    private final String source;
    private final List<ExpressionLexer.Token> tokens;
    private int pos;

    private ExpressionParser(String source) {
        this.source = source;
        this.tokens = ExpressionLexer.tokenize(source);
    }

    static Expression parse(String source) {
        if (source == null || source.isBlank()) {
            throw new ExpressionException("Empty expression", source == null ? "" : source, 0);
        }
        ExpressionParser parser = new ExpressionParser(source);
        Expression root = parser.expression();
        ExpressionLexer.Token trailing = parser.peek();
        if (trailing.kind() != ExpressionLexer.Kind.END) {
            if (trailing.kind() == ExpressionLexer.Kind.RPAREN) {
                throw parser.error("Unbalanced ')'", trailing);
            }
            throw parser.error("Unexpected trailing input '" + trailing.text() + "'", trailing);
        }
        return root;
    }

    private Expression expression() {
        Expression left = term();
        while (peek().kind() == ExpressionLexer.Kind.PLUS || peek().kind() == ExpressionLexer.Kind.MINUS) {
            ExpressionLexer.Token op = next();
            Expression right = term();
            left = new Expression.Binary(op.text().charAt(0), left, right, source, op.position());
        }
        return left;
    }

    private Expression term() {
        Expression left = unary();
        while (peek().kind() == ExpressionLexer.Kind.STAR || peek().kind() == ExpressionLexer.Kind.SLASH) {
            ExpressionLexer.Token op = next();
            Expression right = unary();
            left = new Expression.Binary(op.text().charAt(0), left, right, source, op.position());
        }
        return left;
    }

    private Expression unary() {
        if (peek().kind() == ExpressionLexer.Kind.MINUS) {
            next();
            return new Expression.Negate(unary());
        }
        if (peek().kind() == ExpressionLexer.Kind.PLUS) {
            next();
            return unary();
        }
        return power();
    }

    private Expression power() {
        Expression base = primary();
        if (peek().kind() == ExpressionLexer.Kind.CARET) {
            ExpressionLexer.Token op = next();
            Expression exponent = unary();
            return new Expression.Binary('^', base, exponent, source, op.position());
        }
        return base;
    }

    private Expression primary() {
        ExpressionLexer.Token token = next();
        switch (token.kind()) {
            case NUMBER:
                try {
                    return new Expression.Literal(Double.parseDouble(token.text()));
                } catch (NumberFormatException e) {
                    throw error("Invalid number '" + token.text() + "'", token);
                }
            case IDENTIFIER:
                Optional<NamedConstant> constant = NamedConstant.lookup(token.text());
                if (constant.isPresent()) {
                    return new Expression.Constant(constant.get());
                }
                return new Expression.Variable(token.text(), source, token.position());
            case LPAREN:
                Expression inner = expression();
                ExpressionLexer.Token close = next();
                if (close.kind() != ExpressionLexer.Kind.RPAREN) {
                    throw error("Unbalanced '(' opened", token);
                }
                return inner;
            case END:
                throw error("Unexpected end of expression", token);
            default:
                throw error("Unexpected '" + token.text() + "'", token);
        }
    }

    private ExpressionLexer.Token peek() {
        return tokens.get(pos);
    }

    private ExpressionLexer.Token next() {
        ExpressionLexer.Token token = tokens.get(pos);
        if (token.kind() != ExpressionLexer.Kind.END) {
            pos++;
        }
        return token;
    }

    private ExpressionException error(String message, ExpressionLexer.Token token) {
        return new ExpressionException(message, source, token.position());
    }
}
