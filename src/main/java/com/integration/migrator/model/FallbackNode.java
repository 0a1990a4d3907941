package com.integration.migrator.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Element of an unrecognized type. Nested shapes are kept so that nothing is dropped silently.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class FallbackNode extends ContainerNode {
    private String rawKind;

    public FallbackNode() {
        super(NodeKind.FALLBACK);
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
