package com.integration.migrator.model;

import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class TerminateNode extends ProcessNode {
    private String errorMessage;
    /** Source shape type: Terminate, Throw or Suspend. */
    private String origin = "Terminate";

    public TerminateNode() {
        super(NodeKind.TERMINATE);
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
