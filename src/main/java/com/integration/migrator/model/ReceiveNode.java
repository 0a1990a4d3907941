package com.integration.migrator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Message receive. An activating receive starts a new instance of the flow.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ReceiveNode extends ProcessNode {
    private String portName;
    private String messageName;
    private String operationName;
    private String operationMessageName;
    private boolean activating;
    private List<String> initializesCorrelations = new ArrayList<>();
    private List<String> followsCorrelations = new ArrayList<>();

    public ReceiveNode() {
        super(NodeKind.RECEIVE);
    }

    public boolean initializesAnyCorrelation() {
        return !initializesCorrelations.isEmpty();
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<ProcessNode> structuralChildren() {
        return List.of();
    }
}
