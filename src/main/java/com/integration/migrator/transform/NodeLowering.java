package com.integration.migrator.transform;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.binding.SendPortBinding;
import com.integration.migrator.expression.ExpressionTranslator;
import com.integration.migrator.model.AssignmentNode;
import com.integration.migrator.model.CallPolicyNode;
import com.integration.migrator.model.CatchNode;
import com.integration.migrator.model.CompensateNode;
import com.integration.migrator.model.ConditionalLoopNode;
import com.integration.migrator.model.ConstructNode;
import com.integration.migrator.model.ContainerNode;
import com.integration.migrator.model.CorrelationDeclarationNode;
import com.integration.migrator.model.DecideNode;
import com.integration.migrator.model.DelayNode;
import com.integration.migrator.model.ExpressionNode;
import com.integration.migrator.model.FallbackNode;
import com.integration.migrator.model.GroupNode;
import com.integration.migrator.model.InvocationNode;
import com.integration.migrator.model.ListenNode;
import com.integration.migrator.model.LoopNode;
import com.integration.migrator.model.NodeKind;
import com.integration.migrator.model.ParallelBranchNode;
import com.integration.migrator.model.ParallelNode;
import com.integration.migrator.model.PortDeclaration;
import com.integration.migrator.model.ProcessNode;
import com.integration.migrator.model.ProcessNodeVisitor;
import com.integration.migrator.model.ReceiveNode;
import com.integration.migrator.model.ScopeNode;
import com.integration.migrator.model.SendNode;
import com.integration.migrator.model.SwitchNode;
import com.integration.migrator.model.TaskNode;
import com.integration.migrator.model.TerminateNode;
import com.integration.migrator.model.TransformNode;
import com.integration.migrator.model.UniqueIdGenerator;
import com.integration.migrator.model.VariableDeclarationNode;
import com.integration.migrator.util.NamingUtil;
import com.integration.migrator.workflow.ActionKind;
import com.integration.migrator.workflow.ConnectorKind;
import com.integration.migrator.workflow.WorkflowAction;

/**
 * Lowers process-flow nodes into workflow actions. An empty result means the node has no
 * runtime counterpart (declarations, the activating receive that became the trigger).
 *
 * <p>One instance serves one transformation run.
 */
public class NodeLowering implements ProcessNodeVisitor<Optional<WorkflowAction>> {

    private static final Logger log = LoggerFactory.getLogger(NodeLowering.class);

    static final String RETRY_GUARD = "@equals(variables('" + VariableHoister.RETRY_COMPLETE + "'), true)";

    private static final Pattern PROPERTY_ASSIGNMENT = Pattern.compile("(\\w+)\\.(\\w+)\\s*=\\s*(.+?);");
    private static final Pattern TIME_SPAN =
            Pattern.compile("TimeSpan\\s*\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)");

    private final TransformationContext context;
    private final ExpressionTranslator translator;
    private final SendActionFactory sendActions;

    public NodeLowering(TransformationContext context, ExpressionTranslator translator, SendActionFactory sendActions) {
        this.context = context;
        this.translator = translator;
        this.sendActions = sendActions;
    }

    public List<WorkflowAction> lowerAll(List<? extends ProcessNode> nodes) {
        List<WorkflowAction> actions = new ArrayList<>();
        for (ProcessNode node : nodes) {
            node.accept(this).ifPresent(actions::add);
        }
        return actions;
    }

    @Override
    public Optional<WorkflowAction> visit(ReceiveNode receive) {
        if (receive.isActivating()) {
            if (context.getAnalysis().isPrimary(receive)) {
                return Optional.empty();
            }
            return Optional.of(simple(receive, "Receive", ActionKind.COMPOSE,
                    "Alternate activating receive of " + receive.getMessageName() + " on " + receive.getPortName()));
        }
        WorkflowAction response = simple(receive, "Receive_Response", ActionKind.RESPONSE,
                "Receive response from " + (receive.getPortName() != null ? receive.getPortName() : "correlated port"));
        response.setConnectorKind(ConnectorKind.HTTP);
        response.setOutputMessageName(receive.getMessageName());
        return Optional.of(response);
    }

    @Override
    public Optional<WorkflowAction> visit(SendNode send) {
        String name = send.getDisplayNameOr("Send");
        Optional<SendPortBinding> binding = context.getBindings().findSendPort(send.getPortName());
        WorkflowAction action;
        if (binding.isPresent()) {
            SendPortBinding port = binding.get();
            action = sendActions.connector(name, port.getTransportType(), port.getAddress(), port.getHostAppsSubtype());
        } else {
            Optional<PortDeclaration> port = context.getFlow().findPort(send.getPortName());
            action = sendActions.connector(name,
                    port.map(PortDeclaration::getTransportType).orElse(null),
                    port.map(PortDeclaration::getAddress).orElse(null),
                    null);
        }
        action.setDetails("Send to " + (send.getPortName() != null ? send.getPortName() : "Port"));
        action.setInputMessageName(send.getMessageName());
        action.setSequence(send.getSequence());
        return Optional.of(action);
    }

    @Override
    public Optional<WorkflowAction> visit(DecideNode decide) {
        UniqueIdGenerator ids = context.getFlow().getUniqueIds();
        String token = UniqueIdGenerator.shortToken(ids.assignIfMissing(decide, "DECIDE"));
        String name = NamingUtil.safeActionName(decide.getDisplayNameOr("Decide") + "_" + token);

        if (isExceptionTypeCheck(decide.getExpression())) {
            context.getDiagnostics().warn("Decide '" + decide.getDisplayName()
                    + "' inspects exception types at runtime; kept as a marker for manual implementation");
            WorkflowAction marker = WorkflowAction.builder()
                    .name(name)
                    .kind(ActionKind.COMPOSE)
                    .details("Exception type checks cannot be migrated: " + decide.getExpression())
                    .sourceExpression(decide.getExpression())
                    .sequence(decide.getSequence())
                    .build();
            marker.getChildren().addAll(lowerBranch(decide.getTrueBranch(), "TRUE"));
            return Optional.of(marker);
        }

        WorkflowAction action = WorkflowAction.builder()
                .name(name)
                .kind(ActionKind.IF)
                .details(translator.translate(decide.getExpression(), context.getVariableNames()))
                .sourceExpression(decide.getExpression())
                .sequence(decide.getSequence())
                .build();
        action.getTrueBranch().addAll(lowerBranch(decide.getTrueBranch(), "TRUE"));
        action.getFalseBranch().addAll(lowerBranch(decide.getFalseBranch(), "FALSE"));
        return Optional.of(action);
    }

    /**
     * Lowers one branch of a decision; each lowered root gets its node's id token appended so
     * that identically named shapes in the two branches stay distinct.
     */
    private List<WorkflowAction> lowerBranch(List<ProcessNode> branch, String slot) {
        UniqueIdGenerator ids = context.getFlow().getUniqueIds();
        List<WorkflowAction> lowered = new ArrayList<>();
        for (ProcessNode node : branch) {
            Optional<WorkflowAction> action = node.accept(this);
            if (action.isEmpty()) {
                continue;
            }
            String token = UniqueIdGenerator.shortToken(ids.assignIfMissing(node, slot));
            WorkflowAction root = action.get();
            if (!root.getName().endsWith("_" + token)) {
                root.setName(NamingUtil.safeActionName(root.getName() + "_" + token));
            }
            lowered.add(root);
        }
        return lowered;
    }

    private static boolean isExceptionTypeCheck(String expression) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        return expression.contains("typeof(")
                || (expression.contains(".GetType()") && expression.toLowerCase(Locale.ROOT).contains("exception"));
    }

    @Override
    public Optional<WorkflowAction> visit(SwitchNode switchNode) {
        WorkflowAction action = WorkflowAction.builder()
                .name(NamingUtil.safeActionName(switchNode.getDisplayNameOr("Switch")))
                .kind(ActionKind.SWITCH)
                .details(translator.translate(switchNode.getExpression(), context.getVariableNames()))
                .sourceExpression(switchNode.getExpression())
                .sequence(switchNode.getSequence())
                .build();
        int index = 0;
        for (Map.Entry<String, List<ProcessNode>> entry : switchNode.getCases().entrySet()) {
            WorkflowAction caseScope = WorkflowAction.scope(NamingUtil.safeActionName("Case_" + entry.getKey()),
                    "Case " + entry.getKey());
            caseScope.setSequence(index++);
            caseScope.getChildren().addAll(lowerAll(entry.getValue()));
            action.getChildren().add(caseScope);
        }
        WorkflowAction defaultScope = WorkflowAction.scope("Default", "Default case");
        defaultScope.setSequence(index);
        defaultScope.getChildren().addAll(lowerAll(switchNode.getDefaultCase()));
        action.getChildren().add(defaultScope);
        return Optional.of(action);
    }

    @Override
    public Optional<WorkflowAction> visit(ListenNode listen) {
        WorkflowAction action = simple(listen, "Listen", ActionKind.PARALLEL, "Listen - first branch to complete wins");
        int index = 0;
        for (TaskNode branch : listen.getBranches()) {
            index++;
            WorkflowAction branchScope = WorkflowAction.scope(action.getName() + "_Branch" + index,
                    "Listen branch " + index);
            branchScope.setSequence(branch.getSequence());
            branchScope.getChildren().addAll(lowerAll(branch.getChildren()));
            action.getChildren().add(branchScope);
        }
        return Optional.of(action);
    }

    @Override
    public Optional<WorkflowAction> visit(ParallelNode parallel) {
        WorkflowAction action = simple(parallel, "Parallel", ActionKind.PARALLEL, "Parallel branches");
        int index = 0;
        for (ProcessNode branch : parallel.getChildren()) {
            index++;
            WorkflowAction branchScope = WorkflowAction.scope(
                    NamingUtil.safeActionName(branch.getDisplayNameOr("ParallelBranch_" + index)),
                    branch instanceof ParallelBranchNode ? "Parallel branch" : "Parallel branch (from " + branch.getKind() + ")");
            branchScope.setSequence(branch.getSequence());
            if (branch instanceof ParallelBranchNode parallelBranch) {
                branchScope.getChildren().addAll(lowerAll(parallelBranch.getChildren()));
            } else {
                branch.accept(this).ifPresent(branchScope.getChildren()::add);
            }
            action.getChildren().add(branchScope);
        }
        return Optional.of(action);
    }

    @Override
    public Optional<WorkflowAction> visit(ConstructNode construct) {
        String name = NamingUtil.safeActionName(construct.getDisplayNameOr("Construct"));
        List<ProcessNode> inner = construct.getInner();

        if (inner.isEmpty()) {
            return Optional.of(simple(construct, "Construct", ActionKind.COMPOSE,
                    "Construct Message: " + String.join(", ", construct.getConstructedMessages())));
        }
        if (inner.size() == 1) {
            Optional<WorkflowAction> lowered = lowerConstructInner(construct, inner.get(0));
            lowered.ifPresent(action -> {
                action.setName(name);
                action.setSequence(construct.getSequence());
            });
            return lowered;
        }

        List<TransformNode> transforms = new ArrayList<>();
        List<AssignmentNode> assignments = new ArrayList<>();
        for (ProcessNode node : inner) {
            if (node instanceof TransformNode transform) {
                transforms.add(transform);
            } else if (node instanceof AssignmentNode assignment && assignment.isMessageAssignment()) {
                assignments.add(assignment);
            }
        }

        if (transforms.size() == 1 && !assignments.isEmpty()) {
            WorkflowAction action = lowerTransform(transforms.get(0), construct);
            action.setName(name);
            action.setSequence(construct.getSequence());
            for (AssignmentNode assignment : assignments) {
                action.getPropertyAssignments().putAll(parsePropertyAssignments(assignment.getExpression()));
            }
            return Optional.of(action);
        }

        WorkflowAction scope = WorkflowAction.scope(name, "Construct Message");
        scope.setSequence(construct.getSequence());
        for (TransformNode transform : transforms) {
            scope.getChildren().add(lowerTransform(transform, construct));
        }
        for (AssignmentNode assignment : assignments) {
            Map<String, String> properties = parsePropertyAssignments(assignment.getExpression());
            if (properties.isEmpty()) {
                visit(assignment).ifPresent(scope.getChildren()::add);
            } else {
                WorkflowAction compose = simple(assignment, "MessageAssignment", ActionKind.COMPOSE,
                        "Set message properties");
                compose.getPropertyAssignments().putAll(properties);
                compose.setSourceExpression(assignment.getExpression());
                scope.getChildren().add(compose);
            }
        }
        return Optional.of(scope);
    }

    private Optional<WorkflowAction> lowerConstructInner(ConstructNode construct, ProcessNode node) {
        if (node instanceof TransformNode transform) {
            return Optional.of(lowerTransform(transform, construct));
        }
        return node.accept(this);
    }

    @Override
    public Optional<WorkflowAction> visit(TransformNode transform) {
        return Optional.of(lowerTransform(transform, transform.findAncestor(ConstructNode.class).orElse(null)));
    }

    private WorkflowAction lowerTransform(TransformNode transform, ConstructNode construct) {
        String output = first(transform.getOutputMessages());
        if (output == null && construct != null) {
            output = first(construct.getConstructedMessages());
        }
        return WorkflowAction.builder()
                .name(NamingUtil.safeActionName(transform.getDisplayNameOr("Transform")))
                .kind(ActionKind.TRANSFORM_XSLT)
                .details(transform.getClassRef())
                .transformClassName(transform.getClassRef())
                .inputMessageName(first(transform.getInputMessages()))
                .outputMessageName(output)
                .sequence(transform.getSequence())
                .build();
    }

    /**
     * Extracts {@code Msg.Property = value;} pairs, unquoting string values.
     */
    static Map<String, String> parsePropertyAssignments(String expression) {
        Map<String, String> assignments = new LinkedHashMap<>();
        if (expression == null || expression.isBlank()) {
            return assignments;
        }
        Matcher matcher = PROPERTY_ASSIGNMENT.matcher(expression);
        while (matcher.find()) {
            String value = matcher.group(3).trim();
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            assignments.put(matcher.group(2).trim(), value);
        }
        return assignments;
    }

    @Override
    public Optional<WorkflowAction> visit(AssignmentNode assignment) {
        WorkflowAction action = simple(assignment,
                assignment.isMessageAssignment() ? "MessageAssignment" : "VariableAssignment",
                ActionKind.COMPOSE,
                translator.translate(assignment.getExpression(), context.getVariableNames()));
        action.setSourceExpression(assignment.getExpression());
        return Optional.of(action);
    }

    @Override
    public Optional<WorkflowAction> visit(VariableDeclarationNode declaration) {
        return Optional.empty();
    }

    @Override
    public Optional<WorkflowAction> visit(CorrelationDeclarationNode correlation) {
        return Optional.empty();
    }

    @Override
    public Optional<WorkflowAction> visit(InvocationNode invocation) {
        String target = invocation.getTargetName() != null ? invocation.getTargetName() : "ChildWorkflow";
        if (context.isSelfReference(target)) {
            log.debug("Self-referencing {} of {} lowered to a bounded retry loop", invocation.getKind(), target);
            context.getDiagnostics().info("Self-referencing " + invocation.getKind().name().toLowerCase(Locale.ROOT)
                    + " of " + target + " converted to a retry loop");
            WorkflowAction loop = simple(invocation, "RetryLoop", ActionKind.UNTIL, RETRY_GUARD);
            loop.setSourceExpression(target);
            loop.setLoopThreshold(context.getOptions().getSelfRecursionRetryLimit());
            return Optional.of(loop);
        }
        return Optional.of(simple(invocation, invocation.getKind() == NodeKind.START ? "Start" : "Call",
                ActionKind.INVOKE_WORKFLOW, target));
    }

    @Override
    public Optional<WorkflowAction> visit(TerminateNode terminate) {
        WorkflowAction action = simple(terminate, terminate.getOrigin(), ActionKind.TERMINATE,
                terminate.getErrorMessage() != null ? terminate.getErrorMessage() : "Terminated");
        action.setSourceExpression(terminate.getOrigin());
        return Optional.of(action);
    }

    @Override
    public Optional<WorkflowAction> visit(DelayNode delay) {
        WorkflowAction action = simple(delay, "Delay", ActionKind.DELAY, toDuration(delay.getExpression()));
        action.setSourceExpression(delay.getExpression());
        return Optional.of(action);
    }

    private String toDuration(String expression) {
        if (expression == null || expression.isBlank()) {
            return context.getOptions().getDefaultDelay();
        }
        Matcher span = TIME_SPAN.matcher(expression);
        if (span.find()) {
            return "PT" + span.group(1) + "H" + span.group(2) + "M" + span.group(3) + "S";
        }
        return expression.trim();
    }

    @Override
    public Optional<WorkflowAction> visit(CompensateNode compensate) {
        return Optional.of(simple(compensate, "Compensate", ActionKind.COMPOSE, "Compensate: " + compensate.getTarget()));
    }

    @Override
    public Optional<WorkflowAction> visit(CallPolicyNode callPolicy) {
        return Optional.of(simple(callPolicy, "CallRules", ActionKind.RULE_EXECUTE,
                callPolicy.getPolicyName() != null ? callPolicy.getPolicyName() : "Ruleset"));
    }

    @Override
    public Optional<WorkflowAction> visit(ExpressionNode expression) {
        String text = expression.getExpression() != null ? expression.getExpression() : "";
        String displayName = expression.getDisplayNameOr("Expression");
        boolean condition = displayName.toLowerCase(Locale.ROOT).contains("if") || displayName.contains("?")
                || text.contains("==") || text.contains("!=");
        WorkflowAction action = simple(expression, "Expression", condition ? ActionKind.IF : ActionKind.COMPOSE,
                translator.translate(text, context.getVariableNames()));
        action.setSourceExpression(text);
        return Optional.of(action);
    }

    @Override
    public Optional<WorkflowAction> visit(ScopeNode scope) {
        String prefix = switch (scope.getKind()) {
            case ATOMIC_TRANSACTION -> "AtomicTxn";
            case LONG_RUNNING_TRANSACTION -> "LongRunningTxn";
            case COMPENSATION_SCOPE -> "Compensation";
            default -> "Scope";
        };
        WorkflowAction action = WorkflowAction.scope(
                NamingUtil.safeActionName(scope.getDisplayNameOr(prefix + "_" + scope.getSequence())),
                scopeDetails(scope));
        action.setSequence(scope.getSequence());

        List<ProcessNode> catches = new ArrayList<>();
        for (ProcessNode child : scope.getChildren()) {
            if (child instanceof CatchNode) {
                catches.add(child);
            } else if (!isEmptyTransactionMarker(child)) {
                child.accept(this).ifPresent(action.getChildren()::add);
            }
        }
        action.getChildren().addAll(lowerAll(catches));
        return Optional.of(action);
    }

    private static String scopeDetails(ScopeNode scope) {
        if (scope.getKind() == NodeKind.COMPENSATION_SCOPE) {
            return "Compensation logic";
        }
        boolean hasCatch = scope.getChildren().stream().anyMatch(CatchNode.class::isInstance);
        String details = hasCatch ? "Scope with exception handling" : "Scope";
        return scope.getKind().isTransaction() ? details + " - Transaction" : details;
    }

    private static boolean isEmptyTransactionMarker(ProcessNode node) {
        return node instanceof ScopeNode scope && scope.getKind().isTransaction() && scope.getChildren().isEmpty();
    }

    @Override
    public Optional<WorkflowAction> visit(CatchNode catchNode) {
        WorkflowAction action = WorkflowAction.builder()
                .name(NamingUtil.safeActionName(catchNode.getDisplayNameOr("CatchException_" + catchNode.getSequence())))
                .kind(ActionKind.SCOPE)
                .details("Exception handler: " + catchNode.getExceptionType())
                .sequence(catchNode.getSequence())
                .build();
        action.getChildren().addAll(lowerAll(catchNode.getChildren()));
        return Optional.of(action);
    }

    @Override
    public Optional<WorkflowAction> visit(LoopNode loop) {
        String collection = loop.getCollectionExpression();
        WorkflowAction action = simple(loop, "ForEach", ActionKind.FOREACH,
                collection == null || collection.isBlank()
                        ? "@triggerBody()?['items']"
                        : translator.translate(collection, context.getVariableNames()));
        action.setSourceExpression(collection);
        action.getChildren().addAll(lowerAll(loop.getChildren()));
        return Optional.of(action);
    }

    @Override
    public Optional<WorkflowAction> visit(ConditionalLoopNode conditionalLoop) {
        WorkflowAction action = WorkflowAction.builder()
                .name(NamingUtil.safeActionName(conditionalLoop.getDisplayNameOr("Until")))
                .kind(ActionKind.UNTIL)
                .sequence(conditionalLoop.getSequence())
                .build();
        String expression = conditionalLoop.getExpression();
        if (conditionalLoop.isWhile()) {
            // Inverted into details by the loop condition pass.
            action.setLoopGuard(expression != null ? expression : "true");
        } else {
            action.setDetails(translator.translate(expression, context.getVariableNames()));
            action.setSourceExpression(expression);
            action.setLoopThreshold(LoopConditionPass.thresholdOrDefault(expression));
        }
        action.getChildren().addAll(lowerAll(conditionalLoop.getChildren()));
        return Optional.of(action);
    }

    @Override
    public Optional<WorkflowAction> visit(ParallelBranchNode branch) {
        return Optional.of(container(branch, "ParallelBranch", "Parallel branch"));
    }

    @Override
    public Optional<WorkflowAction> visit(TaskNode task) {
        return Optional.of(container(task, "TaskScope", "Sequential task"));
    }

    @Override
    public Optional<WorkflowAction> visit(GroupNode group) {
        return Optional.of(container(group, "Group", "Group (logical container)"));
    }

    @Override
    public Optional<WorkflowAction> visit(FallbackNode fallback) {
        String details = "Unhandled shape type: " + fallback.getRawKind();
        context.getDiagnostics().warn(details + " (" + fallback.getDisplayNameOr("unnamed") + ")");
        if (fallback.getChildren().isEmpty()) {
            return Optional.of(simple(fallback, "Unhandled", ActionKind.COMPOSE, details));
        }
        WorkflowAction marker = container(fallback, "Unhandled", details);
        return Optional.of(marker);
    }

    private WorkflowAction container(ContainerNode node, String fallbackPrefix, String details) {
        WorkflowAction action = WorkflowAction.scope(
                NamingUtil.safeActionName(node.getDisplayNameOr(fallbackPrefix + "_" + node.getSequence())), details);
        action.setSequence(node.getSequence());
        action.getChildren().addAll(lowerAll(node.getChildren()));
        return action;
    }

    private static WorkflowAction simple(ProcessNode node, String fallbackName, ActionKind kind, String details) {
        return WorkflowAction.builder()
                .name(NamingUtil.safeActionName(node.getDisplayNameOr(fallbackName)))
                .kind(kind)
                .details(details)
                .sequence(node.getSequence())
                .build();
    }

    private static String first(List<String> values) {
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
