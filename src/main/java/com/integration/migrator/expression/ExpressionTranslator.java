package com.integration.migrator.expression;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates imperative orchestration expressions into the workflow expression language.
 *
 * <p>Never throws. Anything that cannot be translated is returned as a quoted literal,
 * so the degraded result stays visible in the output for manual review. Every result
 * starts with {@code @}.
 */
public class ExpressionTranslator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionTranslator.class);

    public static final String NULL_EXPRESSION = "@null";

    private static final Pattern TYPE_CAST = Pattern.compile("^\\(\\s*[\\w.]+\\s*\\)\\s*");
    private static final Pattern PROMOTED_PROPERTY = Pattern.compile("^(\\w+)\\((\\w+)\\.(\\w+)\\)$");
    private static final Pattern DOTTED_ACCESS = Pattern.compile("\\w+\\.\\w+");
    private static final Pattern DOTTED_REFERENCE =
            Pattern.compile("^[A-Za-z_]\\w*(\\.[A-Za-z_]\\w*(\\(\\))?)+$");
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_]\\w*$");
    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^-?\\d+\\.\\d+$");
    private static final Pattern TO_UPPER = Pattern.compile("^(.+)\\.ToUpper\\(\\)$");
    private static final Pattern TO_LOWER = Pattern.compile("^(.+)\\.ToLower\\(\\)$");
    private static final Pattern LIST_ADD = Pattern.compile("^(\\w+)\\.Add\\((\\w+)\\)$");
    private static final Pattern XPATH = Pattern.compile("^xpath\\((\\w+),\\s*\"([^\"]+)\"\\)$");

    private static final Pattern CODE_IF = Pattern.compile("(?i)\\bif\\s*\\(");
    private static final Pattern CODE_LOOP = Pattern.compile("(?i)\\b(for|while|foreach)\\s*\\(");
    private static final Pattern CODE_TRY = Pattern.compile("(?i)\\b(try|catch|finally)\\s*\\{");
    private static final Pattern CODE_SWITCH = Pattern.compile("(?i)\\bswitch\\s*\\(");

    private static final List<String> PLAIN_TEXT_OPERATORS =
            List.of("==", "!=", ">=", "<=", "&&", "||", ">", "<", "=", "+", "-", "*", "/");
    private static final List<String> DESCRIPTIVE_PREFIXES = List.of("Receive (", "Send to");
    private static final Set<String> FRAMEWORK_ROOTS = Set.of("Microsoft", "System", "IBM", "Oracle", "Newtonsoft");

    /** Relational operators in matching order; two-character forms come first. */
    private static final List<String> RELATIONAL_OPERATORS = List.of("==", "!=", ">=", "<=", ">", "<");

    public String translate(String expression) {
        return translate(expression, List.of());
    }

    /**
     * @param expression    source expression, may be null
     * @param variableNames names of declared or discovered workflow variables; other
     *                      identifiers in dotted access are read from message bodies
     */
    public String translate(String expression, Collection<String> variableNames) {
        if (expression == null || expression.isBlank()) {
            return NULL_EXPRESSION;
        }
        String text = stripTrailingSemicolons(expression.trim());
        if (text.isEmpty()) {
            return NULL_EXPRESSION;
        }
        try {
            if (isPlainText(text) || isCodeBlock(text)) {
                return "@" + literal(text);
            }
            return "@" + convert(text, knownVariables(variableNames));
        } catch (RuntimeException e) {
            log.warn("Expression kept as literal after translation failure: {} ({})", text, e.toString());
            return "@" + literal(text);
        }
    }

    private String convert(String text, Set<String> variables) {
        String expr = ExpressionScanner.stripOuterParens(text);

        // XPath arguments may contain operators of their own.
        if (XPATH.matcher(expr).matches()) {
            return convertOperand(expr, variables);
        }

        if (ExpressionScanner.containsTopLevel(expr, "||")) {
            return foldLogical("or", ExpressionScanner.splitTopLevel(expr, "||"), variables);
        }
        if (ExpressionScanner.containsTopLevel(expr, "&&")) {
            return foldLogical("and", ExpressionScanner.splitTopLevel(expr, "&&"), variables);
        }

        for (String operator : RELATIONAL_OPERATORS) {
            if (ExpressionScanner.containsTopLevel(expr, operator)) {
                return convertRelational(expr, operator, variables);
            }
        }

        if (isAssignment(expr)) {
            return literal(expr);
        }

        if (expr.contains("+") && expr.contains("\"")) {
            List<String> parts = splitConcatenation(expr);
            if (parts.size() >= 2) {
                return "concat(" + String.join(", ", parts.stream().map(p -> convertOperand(p, variables)).toList()) + ")";
            }
        }

        return convertOperand(expr, variables);
    }

    private String foldLogical(String function, List<String> parts, Set<String> variables) {
        String folded = convert(parts.get(parts.size() - 1), variables);
        for (int i = parts.size() - 2; i >= 0; i--) {
            folded = function + "(" + convert(parts.get(i), variables) + ", " + folded + ")";
        }
        return folded;
    }

    private String convertRelational(String expr, String operator, Set<String> variables) {
        List<String> parts = ExpressionScanner.splitTopLevel(expr, operator);
        if (parts.size() != 2 || parts.get(0).isEmpty() || parts.get(1).isEmpty()) {
            return literal(expr);
        }
        String left = convertOperand(parts.get(0), variables);
        String right = convertOperand(parts.get(1), variables);
        return switch (operator) {
            case "==" -> "equals(" + left + ", " + right + ")";
            case "!=" -> "not(equals(" + left + ", " + right + "))";
            case ">=" -> "greaterOrEquals(" + left + ", " + right + ")";
            case "<=" -> "lessOrEquals(" + left + ", " + right + ")";
            case ">" -> "greater(" + left + ", " + right + ")";
            case "<" -> "less(" + left + ", " + right + ")";
            default -> literal(expr);
        };
    }

    /**
     * Converts a single operand: a literal, a message or variable reference, or one of the
     * supported method shapes. Anything else becomes a literal.
     */
    private String convertOperand(String operand, Set<String> variables) {
        String trimmed = operand.trim();
        if (trimmed.startsWith("!") && !trimmed.startsWith("!=") && trimmed.length() > 1) {
            return "not(" + convert(trimmed.substring(1).trim(), variables) + ")";
        }
        String value = cleanOperand(operand);
        if (value.isEmpty()) {
            return literal(operand.trim());
        }

        if (ExpressionScanner.isQuotedString(value)) {
            return literal(value.substring(1, value.length() - 1).replace("\\\"", "\""));
        }
        if (INTEGER.matcher(value).matches() || DECIMAL.matcher(value).matches()) {
            return value;
        }
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
            return value.toLowerCase(Locale.ROOT);
        }
        if (value.equals("null")) {
            return "null";
        }

        Matcher upper = TO_UPPER.matcher(value);
        if (upper.matches()) {
            return "toUpper(" + convertOperand(upper.group(1), variables) + ")";
        }
        Matcher lower = TO_LOWER.matcher(value);
        if (lower.matches()) {
            return "toLower(" + convertOperand(lower.group(1), variables) + ")";
        }
        Matcher add = LIST_ADD.matcher(value);
        if (add.matches()) {
            return "union(variables('" + add.group(1) + "'), createArray(variables('" + add.group(2) + "')))";
        }
        Matcher xpath = XPATH.matcher(value);
        if (xpath.matches()) {
            return "xpath(xml(body('" + xpath.group(1) + "')), '" + xpath.group(2).replace("'", "''") + "')";
        }
        Matcher promoted = PROMOTED_PROPERTY.matcher(value);
        if (promoted.matches()) {
            return "variables('" + promoted.group(1) + "')?['" + promoted.group(3) + "']";
        }

        if (DOTTED_REFERENCE.matcher(value).matches()) {
            return convertPropertyAccess(value, variables);
        }
        if (IDENTIFIER.matcher(value).matches()) {
            return convertVariableReference(value);
        }
        return literal(value);
    }

    private String convertPropertyAccess(String value, Set<String> variables) {
        String[] segments = value.split("\\.");
        String first = segments[0];
        String last = segments[segments.length - 1];

        if (ExceptionIdentifiers.isExceptionIdentifier(first)) {
            if (last.equalsIgnoreCase("ToString()")) {
                return "'Exception occurred'";
            }
            if (last.equalsIgnoreCase("Message")) {
                return "'Exception message'";
            }
            return literal(first);
        }

        boolean knownVariable = variables.contains(first);
        if (!knownVariable && isFullyQualifiedReference(segments)) {
            return literal(last);
        }

        StringBuilder access = new StringBuilder(knownVariable ? "variables('" : "body('").append(first).append("')");
        for (int i = 1; i < segments.length; i++) {
            String segment = segments[i];
            if (segment.equals("ToString()")) {
                continue;
            }
            if (segment.endsWith("()")) {
                return literal(value);
            }
            access.append("?['").append(segment).append("']");
        }
        return access.toString();
    }

    private String convertVariableReference(String name) {
        if (ExceptionIdentifiers.isExceptionIdentifier(name)) {
            return literal(name);
        }
        return "variables('" + name + "')";
    }

    private static boolean isFullyQualifiedReference(String[] segments) {
        if (FRAMEWORK_ROOTS.contains(segments[0])) {
            return true;
        }
        if (segments.length < 3) {
            return false;
        }
        for (int i = 0; i < segments.length - 1; i++) {
            if (segments[i].isEmpty() || !Character.isUpperCase(segments[i].charAt(0))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Strips a leading type cast, unbalanced parentheses and trailing punctuation left over
     * from splitting, keeping quoted strings intact. Leading punctuation is kept, so an
     * operand that does not start like one falls through to a literal.
     */
    private static String cleanOperand(String operand) {
        String value = ExpressionScanner.stripOuterParens(operand.trim());

        Matcher cast = TYPE_CAST.matcher(value);
        if (cast.find() && cast.end() < value.length()) {
            value = value.substring(cast.end()).trim();
        }
        if (ExpressionScanner.isQuotedString(value)) {
            return value;
        }

        while (!value.isEmpty() && value.charAt(0) == '(' && count(value, '(') > count(value, ')')) {
            value = value.substring(1).trim();
        }
        while (!value.isEmpty() && value.endsWith(")") && count(value, ')') > count(value, '(')) {
            value = value.substring(0, value.length() - 1).trim();
        }

        int end = value.length();
        while (end > 0 && !isOperandEnd(value.charAt(end - 1), value)) {
            end--;
        }
        return value.substring(0, end);
    }

    private static boolean isOperandEnd(char c, String value) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '"' || (c == ')' && value.indexOf('(') >= 0);
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    /**
     * Splits on '+' outside string literals, so "a+b" + x yields two parts.
     */
    private static List<String> splitConcatenation(String expr) {
        return ExpressionScanner.splitTopLevel(expr, "+").stream().filter(p -> !p.isEmpty()).toList();
    }

    private static boolean isAssignment(String expr) {
        String withoutRelational = expr.replace("==", "").replace("!=", "").replace(">=", "").replace("<=", "");
        return withoutRelational.contains("=");
    }

    static boolean isPlainText(String text) {
        if (text.equalsIgnoreCase("Construct Message") || text.contains("non-activating")) {
            return true;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String prefix : DESCRIPTIVE_PREFIXES) {
            if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        boolean hasOperator = PLAIN_TEXT_OPERATORS.stream().anyMatch(text::contains);
        boolean hasCall = text.contains("(") && !text.startsWith("xpath(");
        boolean hasDottedAccess = DOTTED_ACCESS.matcher(text).find();
        boolean quoted = text.startsWith("\"");
        return !hasOperator && !hasCall && !hasDottedAccess && !quoted && text.contains(" ");
    }

    static boolean isCodeBlock(String text) {
        if (text.contains("\n") || text.contains("\r")) {
            return true;
        }
        if (CODE_IF.matcher(text).find() || CODE_LOOP.matcher(text).find()
                || CODE_TRY.matcher(text).find() || CODE_SWITCH.matcher(text).find()) {
            return true;
        }
        if (text.contains("{") && text.contains("}")) {
            return true;
        }
        return count(text, ';') > 1;
    }

    private static String stripTrailingSemicolons(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == ';') {
            end--;
        }
        return text.substring(0, end).trim();
    }

    private static Set<String> knownVariables(Collection<String> variableNames) {
        Set<String> known = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        if (variableNames != null) {
            variableNames.stream().filter(n -> n != null && !n.isBlank()).forEach(known::add);
        }
        return known;
    }

    static String literal(String text) {
        return "'" + text.replace("'", "''") + "'";
    }
}
