package com.integration.migrator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * First-to-complete wait. Each branch is a {@link TaskNode} owning that branch's shapes.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class ListenNode extends ProcessNode {
    private List<TaskNode> branches = new ArrayList<>();

    public ListenNode() {
        super(NodeKind.LISTEN);
    }

    public void addBranch(TaskNode branch) {
        branches.add(adopt(this, branch));
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<ProcessNode> structuralChildren() {
        return List.copyOf(branches);
    }
}
