package com.integration.migrator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Two-way decision. The branches are separate slots, nothing is kept in a generic child list.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class DecideNode extends ProcessNode {
    private String expression;
    private List<ProcessNode> trueBranch = new ArrayList<>();
    private List<ProcessNode> falseBranch = new ArrayList<>();

    public DecideNode() {
        super(NodeKind.DECIDE);
    }

    public void addTrueBranch(ProcessNode node) {
        trueBranch.add(adopt(this, node));
    }

    public void addFalseBranch(ProcessNode node) {
        falseBranch.add(adopt(this, node));
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<ProcessNode> structuralChildren() {
        List<ProcessNode> all = new ArrayList<>(trueBranch);
        all.addAll(falseBranch);
        return all;
    }
}
