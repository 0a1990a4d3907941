package com.integration.migrator.model;

import java.util.EnumSet;
import java.util.Set;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Plain scope, atomic or long-running transaction, or compensation block.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ScopeNode extends ContainerNode {

    private static final Set<NodeKind> SCOPE_KINDS = EnumSet.of(NodeKind.SCOPE,
            NodeKind.ATOMIC_TRANSACTION, NodeKind.LONG_RUNNING_TRANSACTION, NodeKind.COMPENSATION_SCOPE);

    public ScopeNode(NodeKind kind) {
        super(kind);
        if (!SCOPE_KINDS.contains(kind)) {
            throw new IllegalArgumentException("Not a scope kind: " + kind);
        }
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
