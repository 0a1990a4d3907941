package com.integration.migrator.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.cli.model.MigrateOptions;
import com.integration.migrator.cli.model.ValidatedMigrateOptions;
import com.integration.migrator.export.ReportUnit;

/**
 * Responsible only for printing CLI output for the "migrate" command.
 * No validation, no execution.
 */
public class MigrationResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(MigrationResultsPrinter.class);

    public void printBanner(MigrateOptions o, ValidatedMigrateOptions v) {
        log.info("=================================================");
        log.info("Orchestration Workflow Migrator");
        log.info("=================================================");
        if (v.isBindingsOnly()) {
            log.info("Mode: bindings only");
        } else {
            log.info("Sources: {}", v.getNormalizedSources().size());
            v.getNormalizedSources().forEach(s -> log.info("  {}", s));
        }
        log.info("Bindings: {}", o.getBindings() != null ? o.getBindings().toAbsolutePath() : "None");
        log.info("Callable: {}", o.isCallable());
        log.info("Parallelism: {}", o.getParallelism());
        log.info("Retry Limit: {}", o.getRetryLimit());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("Report: {}", v.getReportFile() != null ? v.getReportFile() : "None");
        log.info("=================================================");
    }

    public void printSummary(List<ReportUnit> units, List<Path> written, Path reportFile) {
        long failed = units.stream().filter(u -> u.getFailure() != null).count();
        long blocked = units.stream().filter(u -> u.getFailure() == null && !u.isValid()).count();

        log.info("");
        log.info("=================================================");
        log.info(failed == 0 ? "MIGRATION COMPLETE" : "MIGRATION COMPLETED WITH FAILURES");
        log.info("=================================================");
        log.info("Units: {}", units.size());
        log.info("Failed: {}", failed);
        log.info("Blocked Trigger Patterns: {}", blocked);

        for (ReportUnit unit : units) {
            if (unit.getFailure() != null) {
                log.error("  {} FAILED: {}", unit.getName(), unit.getFailure());
                continue;
            }
            int actions = unit.getActionCounts().values().stream().mapToInt(Integer::intValue).sum();
            log.info("  {} [{}] actions={} errors={} warnings={}", unit.getName(), unit.getPattern(), actions,
                    unit.getErrors().size(), unit.getWarnings().size());
            unit.getErrors().forEach(e -> log.warn("    error: {}", e));
        }

        log.info("");
        log.info("Files Written: {}", written.size());
        written.forEach(p -> log.info("  {}", p));
        if (reportFile != null) {
            log.info("Report: {}", reportFile);
        }
        log.info("=================================================");
    }
}
