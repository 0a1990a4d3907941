package com.integration.migrator.model;

import java.util.Locale;

/**
 * Issues flow-scoped unique ids. Ids are deterministic for a given parse order,
 * so repeated transformations of the same source produce identical action names.
 */
public class UniqueIdGenerator {

    private static final int TOKEN_LENGTH = 8;

    private int counter;

    public synchronized String next(ProcessNode node, String slot) {
        counter++;
        String base = node.getSourceId() == null || node.getSourceId().isBlank()
                ? node.getKind().name().toLowerCase(Locale.ROOT)
                : node.getSourceId();
        return base + "_" + node.getSequence() + "_" + slot + "_"
                + String.format(Locale.ROOT, "%0" + TOKEN_LENGTH + "x", counter);
    }

    /**
     * Assigns a unique id unless the node already has one, and returns the node's id.
     */
    public String assignIfMissing(ProcessNode node, String slot) {
        if (node.getUniqueId() == null || node.getUniqueId().isBlank()) {
            node.setUniqueId(next(node, slot));
        }
        return node.getUniqueId();
    }

    /**
     * Short disambiguation token of a unique id, used as an action-name suffix.
     */
    public static String shortToken(String uniqueId) {
        if (uniqueId == null || uniqueId.isBlank()) {
            return "";
        }
        String cleaned = uniqueId.replaceAll("[^A-Za-z0-9]", "");
        return cleaned.length() <= TOKEN_LENGTH ? cleaned : cleaned.substring(cleaned.length() - TOKEN_LENGTH);
    }
}
