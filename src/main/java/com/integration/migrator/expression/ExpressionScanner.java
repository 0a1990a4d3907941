package com.integration.migrator.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth- and quote-aware scanning over imperative expression text.
 * Positions inside parentheses or string literals are never split on.
 */
final class ExpressionScanner {

    private ExpressionScanner() {
        // Utility class
    }

    /**
     * Splits on every occurrence of {@code operator} at parenthesis depth zero outside quotes.
     * Returns a single-element list when the operator does not occur at the top level.
     */
    static List<String> splitTopLevel(String text, String operator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean inQuotes = false;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) {
                inQuotes = !inQuotes;
            } else if (!inQuotes) {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                } else if (depth == 0 && text.startsWith(operator, i)) {
                    parts.add(text.substring(start, i).trim());
                    i += operator.length();
                    start = i;
                    continue;
                }
            }
            i++;
        }
        parts.add(text.substring(start).trim());
        return parts;
    }

    /**
     * Index of the first top-level occurrence of {@code operator}, or -1.
     */
    static int indexOfTopLevel(String text, String operator) {
        int depth = 0;
        boolean inQuotes = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) {
                inQuotes = !inQuotes;
            } else if (!inQuotes) {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                } else if (depth == 0 && text.startsWith(operator, i)) {
                    return i;
                }
            }
        }
        return -1;
    }

    static boolean containsTopLevel(String text, String operator) {
        return indexOfTopLevel(text, operator) >= 0;
    }

    /**
     * Removes parentheses that wrap the whole text, repeatedly: "((a))" becomes "a",
     * "(a) && (b)" is left alone.
     */
    static String stripOuterParens(String text) {
        String current = text.trim();
        while (current.length() >= 2 && current.charAt(0) == '(' && closingParen(current, 0) == current.length() - 1) {
            current = current.substring(1, current.length() - 1).trim();
        }
        return current;
    }

    /**
     * Index of the parenthesis closing the one at {@code open}, or -1 when unbalanced.
     */
    static int closingParen(String text, int open) {
        int depth = 0;
        boolean inQuotes = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && (i == 0 || text.charAt(i - 1) != '\\')) {
                inQuotes = !inQuotes;
            } else if (!inQuotes) {
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            }
        }
        return -1;
    }

    static boolean isQuotedString(String text) {
        return text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")
                && text.indexOf('"', 1) == text.length() - 1;
    }
}
