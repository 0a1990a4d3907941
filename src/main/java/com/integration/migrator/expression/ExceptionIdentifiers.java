package com.integration.migrator.expression;

import lombok.experimental.UtilityClass;

/**
 * Naming heuristic for exception variables (ex, exp, eTimeout, soapEx, RollbackException).
 * Such names have no workflow counterpart and are never hoisted or dereferenced.
 */
@UtilityClass
public class ExceptionIdentifiers {

    public static boolean isExceptionIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank() || identifier.length() < 2) {
            return false;
        }
        if (identifier.equalsIgnoreCase("ex") || identifier.equalsIgnoreCase("exp")) {
            return true;
        }
        if (identifier.charAt(0) == 'e' && Character.isUpperCase(identifier.charAt(1))) {
            return true;
        }
        if (identifier.endsWith("Ex") && identifier.length() > 2) {
            return true;
        }
        return identifier.endsWith("Exception") && identifier.length() > "Exception".length();
    }
}
