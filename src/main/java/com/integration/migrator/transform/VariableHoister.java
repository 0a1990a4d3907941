package com.integration.migrator.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.expression.ExceptionIdentifiers;
import com.integration.migrator.model.AssignmentNode;
import com.integration.migrator.model.ConditionalLoopNode;
import com.integration.migrator.model.DecideNode;
import com.integration.migrator.model.InvocationNode;
import com.integration.migrator.model.NodeTraversal;
import com.integration.migrator.model.ProcessNode;
import com.integration.migrator.model.SwitchNode;
import com.integration.migrator.model.VariableDeclarationNode;
import com.integration.migrator.util.NamingUtil;
import com.integration.migrator.workflow.ActionKind;
import com.integration.migrator.workflow.VariableType;
import com.integration.migrator.workflow.WorkflowAction;

/**
 * Collects every variable the flow declares or uses and produces one root-level initializer per
 * name. Workflows only allow variable initialization at the top level, so declarations nested
 * in scopes are lifted out.
 */
public class VariableHoister {

    private static final Logger log = LoggerFactory.getLogger(VariableHoister.class);

    public static final String RETRY_COMPLETE = "retryComplete";

    private static final Pattern ASSIGNMENT_TARGET = Pattern.compile("(?<![.\\w])([A-Za-z_]\\w*)\\s*=(?!=)");
    private static final Pattern CONDITION_IDENTIFIER =
            Pattern.compile("(?<![.\\w])([a-z_][A-Za-z0-9_]*)\\b(?!\\s*[.(])");
    private static final Pattern LINE_COMMENT = Pattern.compile("//.*?$", Pattern.MULTILINE);
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern STRING_LITERAL = Pattern.compile("\"(?:\\\\.|[^\"\\\\])*\"");

    private static final Set<String> KEYWORDS = Set.of(
            "new", "null", "true", "false", "var", "if", "else", "while", "for", "foreach",
            "return", "break", "continue", "switch", "case", "default", "try", "catch",
            "finally", "throw", "using", "namespace", "class", "struct", "interface",
            "enum", "public", "private", "protected", "internal", "static", "readonly",
            "const", "virtual", "override", "abstract", "sealed", "partial", "async",
            "await", "yield", "base", "this", "typeof", "sizeof", "nameof", "is", "as",
            "xpath", "and", "or", "not");

    /**
     * Returns the initializers in first-seen order and records every name in the context.
     * The result depends only on the flow, so hoisting twice yields the same list.
     */
    public List<WorkflowAction> hoist(TransformationContext context) {
        List<ProcessNode> nodes = NodeTraversal.preorder(context.getFlow().getRoots());
        Map<String, WorkflowAction> byLowerName = new LinkedHashMap<>();

        for (ProcessNode node : nodes) {
            if (node instanceof VariableDeclarationNode declaration) {
                String name = declaration.getDisplayName();
                if (isCandidate(name)) {
                    VariableType type = VariableType.fromDeclaredType(declaration.getVarType());
                    register(byLowerName, name, type != null ? type : inferType(name), declaration.getVarType());
                }
            }
        }

        List<String> discovered = new ArrayList<>();
        for (ProcessNode node : nodes) {
            if (node instanceof AssignmentNode assignment) {
                discovered.addAll(assignmentTargets(assignment.getExpression()));
            } else if (node instanceof DecideNode decide) {
                discovered.addAll(conditionIdentifiers(decide.getExpression()));
            } else if (node instanceof ConditionalLoopNode loop) {
                discovered.addAll(conditionIdentifiers(loop.getExpression()));
            } else if (node instanceof SwitchNode switchNode) {
                discovered.addAll(conditionIdentifiers(switchNode.getExpression()));
            }
        }
        for (String name : discovered) {
            if (isCandidate(name) && !byLowerName.containsKey(name.toLowerCase(Locale.ROOT))
                    && context.getFlow().findMessage(name).isEmpty()) {
                log.debug("Synthesizing initializer for undeclared variable {}", name);
                register(byLowerName, name, inferType(name), null);
                context.getSynthesizedVariables().add(name);
            }
        }

        boolean selfRecursive = nodes.stream()
                .anyMatch(n -> n instanceof InvocationNode inv && context.isSelfReference(inv.getTargetName()));
        if (selfRecursive && !byLowerName.containsKey(RETRY_COMPLETE.toLowerCase(Locale.ROOT))) {
            register(byLowerName, RETRY_COMPLETE, VariableType.BOOLEAN, null);
            context.getSynthesizedVariables().add(RETRY_COMPLETE);
        }

        List<WorkflowAction> initializers = new ArrayList<>();
        int sequence = 0;
        for (WorkflowAction initializer : byLowerName.values()) {
            initializer.setSequence(sequence++);
            initializers.add(initializer);
            context.getVariableNames().add(initializer.getOutputMessageName());
        }
        return initializers;
    }

    private static void register(Map<String, WorkflowAction> byLowerName, String name, VariableType type,
            String declaredType) {
        byLowerName.putIfAbsent(name.toLowerCase(Locale.ROOT), WorkflowAction.builder()
                .name(NamingUtil.safeActionName("Initialize_" + name))
                .kind(ActionKind.INITIALIZE_VARIABLE)
                .variableType(type)
                .details(type.defaultValueExpression())
                .sourceExpression(declaredType)
                .outputMessageName(name)
                .build());
    }

    private static boolean isCandidate(String name) {
        return name != null && !name.isBlank() && !ExceptionIdentifiers.isExceptionIdentifier(name);
    }

    static List<String> assignmentTargets(String expression) {
        List<String> names = new ArrayList<>();
        if (expression == null || expression.isBlank()) {
            return names;
        }
        Matcher matcher = ASSIGNMENT_TARGET.matcher(stripLiterals(expression));
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!isKeywordOrTypeName(name) && names.stream().noneMatch(name::equalsIgnoreCase)) {
                names.add(name);
            }
        }
        return names;
    }

    static List<String> conditionIdentifiers(String condition) {
        List<String> names = new ArrayList<>();
        if (condition == null || condition.isBlank()) {
            return names;
        }
        String cleaned = LINE_COMMENT.matcher(condition).replaceAll("");
        cleaned = BLOCK_COMMENT.matcher(cleaned).replaceAll("");
        Matcher matcher = CONDITION_IDENTIFIER.matcher(stripLiterals(cleaned));
        while (matcher.find()) {
            String name = matcher.group(1);
            if (name.length() > 2 && !isKeywordOrTypeName(name) && names.stream().noneMatch(name::equalsIgnoreCase)) {
                names.add(name);
            }
        }
        return names;
    }

    private static String stripLiterals(String text) {
        return STRING_LITERAL.matcher(text).replaceAll("\"\"");
    }

    private static boolean isKeywordOrTypeName(String identifier) {
        if (KEYWORDS.contains(identifier.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return identifier.length() > 1
                && Character.isUpperCase(identifier.charAt(0))
                && Character.isUpperCase(identifier.charAt(1));
    }

    /**
     * Guesses a variable's type from naming conventions: boolean, then integer, array, object,
     * and string as the default.
     */
    static VariableType inferType(String name) {
        String n = name.toLowerCase(Locale.ROOT);
        if (n.startsWith("lb") || n.startsWith("is") || n.startsWith("has") || n.startsWith("can")
                || n.startsWith("should") || containsAny(n, "flag", "enabled", "active", "complete", "done", "success")) {
            return VariableType.BOOLEAN;
        }
        if (n.startsWith("li") || n.startsWith("ln") || n.startsWith("int")
                || containsAny(n, "count", "number", "total", "index", "counter", "size", "length", "quantity")) {
            return VariableType.INTEGER;
        }
        if (n.startsWith("la") || containsAny(n, "list", "array", "collection", "items")) {
            return VariableType.ARRAY;
        }
        if (n.startsWith("lo") || containsAny(n, "enumerator", "iterator", "document") || n.endsWith("object")
                || (n.contains("message") && !n.contains("number"))) {
            return VariableType.OBJECT;
        }
        return VariableType.STRING;
    }

    private static boolean containsAny(String text, String... parts) {
        for (String part : parts) {
            if (text.contains(part)) {
                return true;
            }
        }
        return false;
    }
}
