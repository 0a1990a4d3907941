package com.integration.migrator.workflow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Builder;
import lombok.Data;

/**
 * One node of the action graph. Children are owned exclusively by their parent action.
 */
@Data
@Builder
public class WorkflowAction {
    /** Upstream marker for data that arrives with the trigger. */
    public static final String TRIGGER_SOURCE = "trigger";

    private String name;
    private ActionKind kind;
    private String details;
    private String sourceExpression;
    private int sequence;

    @Builder.Default
    private List<WorkflowAction> children = new ArrayList<>();
    @Builder.Default
    private List<WorkflowAction> trueBranch = new ArrayList<>();
    @Builder.Default
    private List<WorkflowAction> falseBranch = new ArrayList<>();

    private ConnectorKind connectorKind;
    private String targetAddress;
    private String queueOrTopicName;
    private String topic;
    private String subscriptionName;

    private String inputMessageName;
    private String inputSourceAction;
    private String outputMessageName;
    @Builder.Default
    private Map<String, String> propertyAssignments = new LinkedHashMap<>();
    private String transformClassName;

    private boolean branchContainer;
    private Integer loopThreshold;
    private String loopGuard;
    private VariableType variableType;

    public static WorkflowAction compose(String name, String details) {
        return WorkflowAction.builder().name(name).kind(ActionKind.COMPOSE).details(details).build();
    }

    public static WorkflowAction scope(String name, String details) {
        return WorkflowAction.builder().name(name).kind(ActionKind.SCOPE).details(details).branchContainer(true).build();
    }

    /**
     * Depth-first, pre-order walk over this action and everything it owns.
     */
    @JsonIgnore
    public List<WorkflowAction> flatten() {
        List<WorkflowAction> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(WorkflowAction action, List<WorkflowAction> out) {
        out.add(action);
        action.getChildren().forEach(child -> collect(child, out));
        action.getTrueBranch().forEach(child -> collect(child, out));
        action.getFalseBranch().forEach(child -> collect(child, out));
    }
}
