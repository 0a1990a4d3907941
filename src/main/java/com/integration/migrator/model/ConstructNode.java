package com.integration.migrator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Message construction block. Inner nodes are transforms followed by message assignments.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ConstructNode extends ProcessNode {
    private List<String> constructedMessages = new ArrayList<>();
    private List<ProcessNode> inner = new ArrayList<>();

    public ConstructNode() {
        super(NodeKind.CONSTRUCT);
    }

    public void addInner(ProcessNode node) {
        inner.add(adopt(this, node));
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<ProcessNode> structuralChildren() {
        return List.copyOf(inner);
    }
}
