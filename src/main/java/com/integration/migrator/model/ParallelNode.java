package com.integration.migrator.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Parallel actions. Children are {@link ParallelBranchNode}s, all of which must complete.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ParallelNode extends ContainerNode {

    public ParallelNode() {
        super(NodeKind.PARALLEL);
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
