package com.integration.migrator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Tree walks built on {@link ProcessNode#structuralChildren()}.
 */
public final class NodeTraversal {

    private NodeTraversal() {
        // Utility class
    }

    /**
     * All nodes reachable from the given roots, in preorder.
     */
    public static List<ProcessNode> preorder(List<? extends ProcessNode> roots) {
        List<ProcessNode> out = new ArrayList<>();
        for (ProcessNode root : roots) {
            collect(root, out);
        }
        return out;
    }

    public static <T extends ProcessNode> List<T> findAll(List<? extends ProcessNode> roots, Class<T> type) {
        return preorder(roots).stream().filter(type::isInstance).map(type::cast).toList();
    }

    public static List<ProcessNode> findAll(List<? extends ProcessNode> roots, Predicate<ProcessNode> filter) {
        return preorder(roots).stream().filter(filter).toList();
    }

    private static void collect(ProcessNode node, List<ProcessNode> out) {
        out.add(node);
        for (ProcessNode child : node.structuralChildren()) {
            collect(child, out);
        }
    }
}
