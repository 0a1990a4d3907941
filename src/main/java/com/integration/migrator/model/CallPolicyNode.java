package com.integration.migrator.model;

import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Business rules engine call.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class CallPolicyNode extends ProcessNode {
    private String policyName;

    public CallPolicyNode() {
        super(NodeKind.CALL_POLICY);
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
