package com.integration.migrator.expression;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Logical negation of imperative boolean expressions, used to turn a "repeat while"
 * guard into a "repeat until" guard.
 *
 * <p>Compound conditions are inverted with De Morgan's laws, splitting at the top-level
 * {@code ||} first since it binds loosest. Relational atoms flip their operator;
 * anything else is negated with {@code !}. Inverting twice yields the normalized input.
 */
public class ConditionInverter {

    private static final Pattern SIMPLE_OPERAND = Pattern.compile("^[\\w.()]+$");

    public String invert(String condition) {
        if (condition == null || condition.isBlank()) {
            return condition;
        }
        String expr = ExpressionScanner.stripOuterParens(condition);

        List<String> disjuncts = ExpressionScanner.splitTopLevel(expr, "||");
        if (disjuncts.size() > 1) {
            return join(disjuncts, " && ");
        }
        List<String> conjuncts = ExpressionScanner.splitTopLevel(expr, "&&");
        if (conjuncts.size() > 1) {
            return join(conjuncts, " || ");
        }
        return invertAtom(expr);
    }

    private String join(List<String> operands, String operator) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) {
                out.append(operator);
            }
            String inverted = invert(operands.get(i));
            out.append(isCompound(inverted) ? "(" + inverted + ")" : inverted);
        }
        return out.toString();
    }

    private static boolean isCompound(String expr) {
        return ExpressionScanner.containsTopLevel(expr, "||") || ExpressionScanner.containsTopLevel(expr, "&&");
    }

    private String invertAtom(String atom) {
        int depth = 0;
        boolean inQuotes = false;
        for (int i = 0; i < atom.length(); i++) {
            char c = atom.charAt(i);
            if (c == '"' && (i == 0 || atom.charAt(i - 1) != '\\')) {
                inQuotes = !inQuotes;
                continue;
            }
            if (inQuotes) {
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0) {
                String operator = relationalAt(atom, i);
                if (operator != null) {
                    return atom.substring(0, i) + opposite(operator) + atom.substring(i + operator.length());
                }
            }
        }

        if (atom.startsWith("!") && !atom.startsWith("!=")) {
            return ExpressionScanner.stripOuterParens(atom.substring(1));
        }
        return SIMPLE_OPERAND.matcher(atom).matches() ? "!" + atom : "!(" + atom + ")";
    }

    private static String relationalAt(String text, int index) {
        for (String operator : List.of("<=", ">=", "==", "!=")) {
            if (text.startsWith(operator, index)) {
                return operator;
            }
        }
        char c = text.charAt(index);
        if (c == '<' || c == '>') {
            return String.valueOf(c);
        }
        return null;
    }

    private static String opposite(String operator) {
        return switch (operator) {
            case "<" -> ">=";
            case ">=" -> "<";
            case ">" -> "<=";
            case "<=" -> ">";
            case "==" -> "!=";
            case "!=" -> "==";
            default -> throw new IllegalArgumentException("Not a relational operator: " + operator);
        };
    }
}
