package com.integration.migrator.parser;

/**
 * Raised when an orchestration source cannot be turned into a model at all.
 * Callers must not continue with a partial model.
 */
public class MalformedSourceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MalformedSourceException(String message) {
        super(message);
    }

    public MalformedSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
