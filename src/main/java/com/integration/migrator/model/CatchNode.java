package com.integration.migrator.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class CatchNode extends ContainerNode {
    private String exceptionType = "System.Exception";
    private String exceptionVariable = "ex";

    public CatchNode() {
        super(NodeKind.CATCH);
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
