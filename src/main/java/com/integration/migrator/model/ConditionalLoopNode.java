package com.integration.migrator.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * While loop (continue while the guard holds) or until loop (stop once it holds).
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ConditionalLoopNode extends ContainerNode {
    private String expression;

    public ConditionalLoopNode(NodeKind kind) {
        super(kind);
        if (kind != NodeKind.WHILE && kind != NodeKind.UNTIL) {
            throw new IllegalArgumentException("Not a conditional loop kind: " + kind);
        }
    }

    public boolean isWhile() {
        return kind == NodeKind.WHILE;
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
