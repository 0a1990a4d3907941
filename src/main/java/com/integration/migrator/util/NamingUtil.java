package com.integration.migrator.util;

/**
 * Naming rules for workflow actions.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Keeps letters, digits, underscores, hyphens and spaces; spaces become underscores.
     * A leading digit gets an {@code Action_} prefix and an empty result becomes {@code Unnamed}.
     */
    public static String safeActionName(String name) {
        if (name == null) {
            return "Unnamed";
        }
        StringBuilder kept = new StringBuilder();
        for (char c : name.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == ' ') {
                kept.append(c == ' ' ? '_' : c);
            }
        }
        String result = kept.toString();
        if (result.isEmpty()) {
            return "Unnamed";
        }
        if (Character.isDigit(result.charAt(0))) {
            return "Action_" + result;
        }
        return result;
    }

    /**
     * Last dotted segment of a qualified name.
     */
    public static String lastSegment(String qualifiedName) {
        if (qualifiedName == null) {
            return null;
        }
        int dot = qualifiedName.lastIndexOf('.');
        return dot >= 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
    }
}
