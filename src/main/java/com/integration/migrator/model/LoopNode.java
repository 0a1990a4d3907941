package com.integration.migrator.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * For-each loop over a collection expression.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class LoopNode extends ContainerNode {
    private String collectionExpression;
    private String itemVariable = "item";

    public LoopNode() {
        super(NodeKind.LOOP);
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
