package com.integration.migrator.batch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.binding.BindingSnapshot;
import com.integration.migrator.model.FlowSummary;
import com.integration.migrator.parser.MalformedSourceException;
import com.integration.migrator.parser.OrchestrationParser;
import com.integration.migrator.transform.TransformOptions;
import com.integration.migrator.transform.WorkflowTransformer;

/**
 * Migrates several orchestrations concurrently. Units share nothing but the read-only bindings;
 * a failing unit is reported in its outcome and does not affect the others.
 */
public class BatchMigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchMigrationRunner.class);

    private final WorkflowTransformer transformer;
    private final int parallelism;

    public BatchMigrationRunner(WorkflowTransformer transformer, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        this.transformer = transformer;
        this.parallelism = parallelism;
    }

    /**
     * Outcomes are returned in source order.
     */
    public List<UnitOutcome> run(List<Path> sources, BindingSnapshot bindings, TransformOptions options) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, sources.size())));
        try {
            List<Future<UnitOutcome>> futures = new ArrayList<>();
            for (Path source : sources) {
                futures.add(pool.submit(() -> migrate(source, bindings, options)));
            }
            List<UnitOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), sources.get(i)));
            }
            return outcomes;
        } finally {
            pool.shutdown();
        }
    }

    UnitOutcome migrate(Path source, BindingSnapshot bindings, TransformOptions options) {
        try {
            log.info("Migrating {}", source);
            FlowSummary flow = OrchestrationParser.parseFile(source);
            return UnitOutcome.success(source, transformer.transform(flow, bindings, options));
        } catch (MalformedSourceException e) {
            log.error("Cannot parse {}: {}", source, e.getMessage());
            return UnitOutcome.failure(source, e.getMessage());
        } catch (IOException e) {
            log.error("Cannot read {}: {}", source, e.getMessage());
            return UnitOutcome.failure(source, "I/O error: " + e.getMessage());
        }
    }

    private static UnitOutcome await(Future<UnitOutcome> future, Path source) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UnitOutcome.failure(source, "Interrupted before completion");
        } catch (ExecutionException e) {
            log.error("Migration of {} failed with exception", source, e.getCause());
            return UnitOutcome.failure(source, String.valueOf(e.getCause()));
        }
    }
}
