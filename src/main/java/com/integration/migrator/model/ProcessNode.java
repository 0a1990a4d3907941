package com.integration.migrator.model;

import java.util.List;
import java.util.Optional;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Base class for all process-flow nodes.
 *
 * <p>Each node is owned by exactly one collection: a container's child list or one
 * named slot of a branching node. {@link #parent} is a non-owning back-reference
 * used for ancestor lookups only.
 */
@Data
public abstract sealed class ProcessNode
        permits ContainerNode, ReceiveNode, SendNode, DecideNode, SwitchNode, ListenNode,
        ConstructNode, TransformNode, VariableDeclarationNode, AssignmentNode,
        CorrelationDeclarationNode, InvocationNode, TerminateNode, DelayNode,
        CompensateNode, CallPolicyNode, ExpressionNode {

    protected NodeKind kind;
    protected String sourceId;
    protected String displayName;
    protected int sequence;
    protected String uniqueId;
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    protected ProcessNode parent;

    protected ProcessNode(NodeKind kind) {
        this.kind = kind;
    }

    public abstract <R> R accept(ProcessNodeVisitor<R> visitor);

    /**
     * Nodes owned by this node across all of its slots, in slot order.
     */
    public abstract List<ProcessNode> structuralChildren();

    public <T extends ProcessNode> Optional<T> findAncestor(Class<T> type) {
        ProcessNode current = parent;
        while (current != null) {
            if (type.isInstance(current)) {
                return Optional.of(type.cast(current));
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    public String getDisplayNameOr(String fallback) {
        return displayName == null || displayName.isBlank() ? fallback : displayName;
    }

    protected static <T extends ProcessNode> T adopt(ProcessNode owner, T child) {
        child.setParent(owner);
        return child;
    }
}
