package com.integration.migrator.config;

import java.nio.file.Path;
import java.util.List;

import com.integration.migrator.transform.TransformOptions;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for one migration run, assembled from validated command-line options.
 */
@Data
@Builder
public class MigratorConfig {

    /**
     * Orchestration sources to migrate. Empty for a bindings-only run.
     */
    @Singular
    private List<Path> sourceFiles;

    /**
     * Binding file; optional.
     */
    private Path bindingsFile;

    /**
     * Whether every migrated workflow is started by its parent (request trigger).
     */
    private boolean callable;

    private Path outputDir;

    /**
     * Markdown report path; no report is written when null.
     */
    private Path reportFile;

    private boolean force;

    @Builder.Default
    private int parallelism = 1;

    @Builder.Default
    private int selfRecursionRetryLimit = TransformOptions.DEFAULT_RETRY_LIMIT;

    public boolean isBindingsOnly() {
        return sourceFiles.isEmpty() && bindingsFile != null;
    }

    public TransformOptions toTransformOptions() {
        return TransformOptions.builder()
                .callable(callable)
                .selfRecursionRetryLimit(selfRecursionRetryLimit)
                .build();
    }
}
