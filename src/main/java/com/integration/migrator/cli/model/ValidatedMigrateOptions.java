package com.integration.migrator.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps MigrateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedMigrateOptions {
    boolean bindingsOnly;
    List<Path> normalizedSources;
    Path normalizedOutputDir;
    Path reportFile;
}
