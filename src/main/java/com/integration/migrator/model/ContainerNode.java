package com.integration.migrator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Node that owns a single ordered child list.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public abstract sealed class ContainerNode extends ProcessNode
        permits ScopeNode, LoopNode, ConditionalLoopNode, ParallelNode, ParallelBranchNode,
        TaskNode, GroupNode, CatchNode, FallbackNode {

    protected List<ProcessNode> children = new ArrayList<>();

    protected ContainerNode(NodeKind kind) {
        super(kind);
    }

    public void addChild(ProcessNode child) {
        children.add(adopt(this, child));
    }

    @Override
    public List<ProcessNode> structuralChildren() {
        return List.copyOf(children);
    }
}
