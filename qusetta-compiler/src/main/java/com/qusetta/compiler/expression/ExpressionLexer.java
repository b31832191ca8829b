/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.expression;

import com.qusetta.api.exceptions.ExpressionException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an angle expression into tokens. {@code **} is read as {@code ^} and
 * {@code π} as the identifier {@code PI}.
 */
final class ExpressionLexer {

    enum Kind { NUMBER, IDENTIFIER, PLUS, MINUS, STAR, SLASH, CARET, LPAREN, RPAREN, END }

    record Token(Kind kind, String text, int position) {}

    private ExpressionLexer() {
    }

    static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = source.length();
        while (i < n) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(source.charAt(i + 1)))) {
                int end = scanNumber(source, i);
                tokens.add(new Token(Kind.NUMBER, source.substring(i, end), i));
                i = end;
            } else if (Character.isLetter(c) && c != 'π' || c == '_') {
                int end = i + 1;
                while (end < n && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) {
                    end++;
                }
                tokens.add(new Token(Kind.IDENTIFIER, source.substring(i, end), i));
                i = end;
            } else {
                switch (c) {
                    case 'π' -> tokens.add(new Token(Kind.IDENTIFIER, "PI", i));
                    case '+' -> tokens.add(new Token(Kind.PLUS, "+", i));
                    case '-' -> tokens.add(new Token(Kind.MINUS, "-", i));
                    case '/' -> tokens.add(new Token(Kind.SLASH, "/", i));
                    case '^' -> tokens.add(new Token(Kind.CARET, "^", i));
                    case '(' -> tokens.add(new Token(Kind.LPAREN, "(", i));
                    case ')' -> tokens.add(new Token(Kind.RPAREN, ")", i));
                    case '*' -> {
                        if (i + 1 < n && source.charAt(i + 1) == '*') {
                            tokens.add(new Token(Kind.CARET, "**", i));
                            i++;
                        } else {
                            tokens.add(new Token(Kind.STAR, "*", i));
                        }
                    }
                    default -> throw new ExpressionException("Unexpected character '" + c + "'", source, i);
                }
                i++;
            }
        }
        tokens.add(new Token(Kind.END, "", n));
        return tokens;
    }

    // digits [. digits] [(e|E) [+|-] digits]; the exponent is only consumed when digits follow
    private static int scanNumber(String source, int start) {
        int n = source.length();
        int i = start;
        while (i < n && Character.isDigit(source.charAt(i))) i++;
        if (i < n && source.charAt(i) == '.') {
            i++;
            while (i < n && Character.isDigit(source.charAt(i))) i++;
        }
        if (i < n && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < n && (source.charAt(j) == '+' || source.charAt(j) == '-')) j++;
            if (j < n && Character.isDigit(source.charAt(j))) {
                while (j < n && Character.isDigit(source.charAt(j))) j++;
                i = j;
            }
        }
        return i;
    }
}
