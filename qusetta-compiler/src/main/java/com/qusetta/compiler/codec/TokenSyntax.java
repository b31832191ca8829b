/*
 * Copyright (c) 2025 Qusetta
 * Licensed under the Apache License, Version 2.0
 */
package com.qusetta.compiler.codec;

import com.qusetta.api.exceptions.MalformedTokenException;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural split of a gate token into its name and parenthesized argument groups.
 *
 * <p>Only the shape is checked here: a name, then at most two balanced groups and nothing
 * after them. Entries are split on top-level commas and trimmed, so nested parentheses
 * inside a parameter expression are kept intact. Interpreting the entries (gate lookup,
 * arity, qubit literals, expressions) is left to the caller.
 */
public final class TokenSyntax {

    /**
     * @param name   the leading identifier
     * @param groups zero to two argument groups; an empty group {@code ()} has no entries
     */
    public record Parts(String name, List<List<String>> groups) {

        /**
         * @return the parameter entries: the first of two groups, otherwise none
         */
        public List<String> parameterEntries() {
            return groups.size() == 2 ? groups.get(0) : List.of();
        }

        /**
         * @return the qubit entries: the last group, or none for a bare name
         */
        public List<String> qubitEntries() {
            return groups.isEmpty() ? List.of() : groups.get(groups.size() - 1);
        }
    }

    private TokenSyntax() {
    }

    public static Parts parse(String token) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Empty gate token", token == null ? "" : token);
        }
        String text = token.strip();
        int n = text.length();

        int i = 0;
        if (!isNameStart(text.charAt(0))) {
            throw new MalformedTokenException("Gate token must start with a gate name", token);
        }
        while (i < n && isNamePart(text.charAt(i))) {
            i++;
        }
        String name = text.substring(0, i);

        List<List<String>> groups = new ArrayList<>(2);
        while (true) {
            i = skipWhitespace(text, i);
            if (i >= n) break;
            if (text.charAt(i) != '(') {
                throw new MalformedTokenException("Unexpected text after argument list", token);
            }
            int close = matchingParen(text, i);
            if (close < 0) {
                throw new MalformedTokenException("Unbalanced parentheses", token);
            }
            if (groups.size() == 2) {
                throw new MalformedTokenException("At most two argument groups are allowed", token);
            }
            groups.add(splitEntries(text.substring(i + 1, close)));
            i = close + 1;
        }
        return new Parts(name, List.copyOf(groups));
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static int skipWhitespace(String text, int i) {
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int matchingParen(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static List<String> splitEntries(String content) {
        if (content.isBlank()) {
            return List.of();
        }
        List<String> entries = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                entries.add(content.substring(start, i).strip());
                start = i + 1;
            }
        }
        entries.add(content.substring(start).strip());
        return List.copyOf(entries);
    }
}
