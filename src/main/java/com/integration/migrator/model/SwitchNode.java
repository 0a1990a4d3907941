package com.integration.migrator.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Multi-way decision. Case keys keep source order.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class SwitchNode extends ProcessNode {
    private String expression;
    private Map<String, List<ProcessNode>> cases = new LinkedHashMap<>();
    private List<ProcessNode> defaultCase = new ArrayList<>();

    public SwitchNode() {
        super(NodeKind.SWITCH);
    }

    public void addCase(String key, ProcessNode node) {
        cases.computeIfAbsent(key, k -> new ArrayList<>()).add(adopt(this, node));
    }

    /**
     * Registers a case key even when the case has no shapes.
     */
    public void declareCase(String key) {
        cases.computeIfAbsent(key, k -> new ArrayList<>());
    }

    public void addDefault(ProcessNode node) {
        defaultCase.add(adopt(this, node));
    }

    @Override
    public <R> R accept(ProcessNodeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<ProcessNode> structuralChildren() {
        List<ProcessNode> all = new ArrayList<>();
        cases.values().forEach(all::addAll);
        all.addAll(defaultCase);
        return all;
    }
}
