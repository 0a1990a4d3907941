package com.integration.migrator.transform;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Findings accumulated while migrating one unit. Errors are blocking findings; the
 * transformation still completes and the output is kept for review.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class MigrationDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void error(String message) {
        errors.add(message);
    }

    public void warn(String message) {
        warnings.add(message);
    }

    public void info(String message) {
        infos.add(message);
    }
}
