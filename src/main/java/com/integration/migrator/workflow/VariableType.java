package com.integration.migrator.workflow;

import java.util.Locale;

public enum VariableType {
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING,
    ARRAY,
    OBJECT;

    /**
     * Maps a declared source type name; returns null for a missing type so callers can
     * fall back to name-based inference.
     */
    public static VariableType fromDeclaredType(String declaredType) {
        if (declaredType == null || declaredType.isBlank()) {
            return null;
        }
        String type = declaredType.trim().toLowerCase(Locale.ROOT);
        int dot = type.lastIndexOf('.');
        String simple = dot >= 0 && !type.endsWith("[]") ? type.substring(dot + 1) : type;
        if (simple.endsWith("[]") || simple.contains("list") || simple.contains("array")) {
            return ARRAY;
        }
        return switch (simple) {
            case "bool", "boolean" -> BOOLEAN;
            case "int", "int16", "int32", "int64", "long", "short" -> INTEGER;
            case "double", "decimal", "float", "single" -> FLOAT;
            case "string", "char" -> STRING;
            default -> OBJECT;
        };
    }

    public String defaultValueExpression() {
        return switch (this) {
            case BOOLEAN -> "@false";
            case INTEGER -> "@0";
            case FLOAT -> "@float('0')";
            case STRING -> "@''";
            case ARRAY -> "@createArray()";
            case OBJECT -> "@json('{}')";
        };
    }
}
