package com.integration.migrator.model;

import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class CompensateNode extends ProcessNode {
    private String target;

    public CompensateNode() {
        super(NodeKind.COMPENSATE);
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
