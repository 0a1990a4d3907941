package com.integration.migrator.model;

import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Synchronous call or asynchronous start of another orchestration.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class InvocationNode extends ProcessNode {
    private String targetName;

    public InvocationNode(NodeKind kind) {
        super(kind);
        if (kind != NodeKind.CALL && kind != NodeKind.START) {
            throw new IllegalArgumentException("Not an invocation kind: " + kind);
        }
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
