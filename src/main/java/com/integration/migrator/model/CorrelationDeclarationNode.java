package com.integration.migrator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class CorrelationDeclarationNode extends ProcessNode {
    private String typeRef;
    private List<CorrelationStatementRef> statementRefs = new ArrayList<>();

    public CorrelationDeclarationNode() {
        super(NodeKind.CORRELATION_DECLARATION);
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
