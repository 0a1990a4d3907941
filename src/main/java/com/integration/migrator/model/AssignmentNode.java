package com.integration.migrator.model;

import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Message or variable assignment. {@code kind} tells which.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class AssignmentNode extends ProcessNode {
    private String expression;

    public AssignmentNode(NodeKind kind) {
        super(requireAssignmentKind(kind));
    }

    private static NodeKind requireAssignmentKind(NodeKind kind) {
        if (kind != NodeKind.MESSAGE_ASSIGNMENT && kind != NodeKind.VARIABLE_ASSIGNMENT) {
            throw new IllegalArgumentException("Not an assignment kind: " + kind);
        }
        return kind;
    }

    public boolean isMessageAssignment() {
        return kind == NodeKind.MESSAGE_ASSIGNMENT;
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
