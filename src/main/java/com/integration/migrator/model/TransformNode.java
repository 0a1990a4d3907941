package com.integration.migrator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class TransformNode extends ProcessNode {
    private String classRef;
    private List<String> inputMessages = new ArrayList<>();
    private List<String> outputMessages = new ArrayList<>();

    public TransformNode() {
        super(NodeKind.TRANSFORM);
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
