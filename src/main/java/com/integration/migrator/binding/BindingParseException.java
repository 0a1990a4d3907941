package com.integration.migrator.binding;

/**
 * Raised when a binding file is not well-formed XML.
 */
public class BindingParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public BindingParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
