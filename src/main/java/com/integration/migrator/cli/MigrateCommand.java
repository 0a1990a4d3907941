package com.integration.migrator.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.batch.BatchMigrationRunner;
import com.integration.migrator.batch.UnitOutcome;
import com.integration.migrator.binding.BindingParser;
import com.integration.migrator.binding.BindingSnapshot;
import com.integration.migrator.cli.exception.OptionsValidationException;
import com.integration.migrator.cli.model.MigrateOptions;
import com.integration.migrator.cli.model.ValidatedMigrateOptions;
import com.integration.migrator.cli.output.MigrationResultsPrinter;
import com.integration.migrator.cli.validation.MigrateOptionsValidator;
import com.integration.migrator.config.MigratorConfig;
import com.integration.migrator.export.ActionGraphJsonWriter;
import com.integration.migrator.export.MigrationReportWriter;
import com.integration.migrator.export.ReportUnit;
import com.integration.migrator.transform.TransformationResult;
import com.integration.migrator.transform.WorkflowTransformer;
import com.integration.migrator.workflow.Workflow;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that migrates orchestrations and binding files into workflow action graphs.
 */
@Command(
        name = "migrate",
        mixinStandardHelpOptions = true,
        version = "orchestration-workflow-migrator 1.0.0",
        description = "Transpiles BizTalk orchestrations and binding files into workflow action graphs."
)
public class MigrateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MigrateCommand.class);

    @Mixin
    private MigrateOptions options = new MigrateOptions();

    private final MigrateOptionsValidator validator = new MigrateOptionsValidator();
    private final MigrationResultsPrinter printer = new MigrationResultsPrinter();

    @Override
    public Integer call() {
        ValidatedMigrateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }

        try {
            MigratorConfig config = toConfig(validated);
            printer.printBanner(options, validated);
            return migrate(config);
        } catch (Exception e) {
            log.error("Migration failed with exception", e);
            return 1;
        }
    }

    private MigratorConfig toConfig(ValidatedMigrateOptions v) {
        return MigratorConfig.builder()
                .sourceFiles(v.getNormalizedSources())
                .bindingsFile(options.getBindings())
                .callable(options.isCallable())
                .outputDir(v.getNormalizedOutputDir())
                .reportFile(v.getReportFile())
                .force(options.isForce())
                .parallelism(options.getParallelism())
                .selfRecursionRetryLimit(options.getRetryLimit())
                .build();
    }

    private int migrate(MigratorConfig config) throws Exception {
        BindingSnapshot bindings = config.getBindingsFile() == null
                ? BindingSnapshot.empty()
                : new BindingParser().parseFile(config.getBindingsFile());

        WorkflowTransformer transformer = new WorkflowTransformer();
        List<Workflow> workflows = new ArrayList<>();
        List<ReportUnit> units = new ArrayList<>();
        boolean hardFailure = false;

        if (config.isBindingsOnly()) {
            TransformationResult result = transformer.synthesizeFromBindings(bindings);
            for (Workflow workflow : result.getWorkflows()) {
                workflows.add(workflow);
                units.add(MigrationReportWriter.fromResult(workflow, result, config.getBindingsFile().toString()));
            }
        } else {
            List<UnitOutcome> outcomes = new BatchMigrationRunner(transformer, config.getParallelism())
                    .run(config.getSourceFiles(), bindings, config.toTransformOptions());
            for (UnitOutcome outcome : outcomes) {
                outcome.getResult().ifPresent(r -> workflows.addAll(r.getWorkflows()));
                units.add(MigrationReportWriter.fromOutcome(outcome));
                hardFailure |= !outcome.isSuccess();
            }
        }

        List<Path> written = new ActionGraphJsonWriter().write(workflows, config.getOutputDir());
        if (config.getReportFile() != null) {
            new MigrationReportWriter().write(units, config.getReportFile());
        }

        printer.printSummary(units, written, config.getReportFile());

        if (written.isEmpty()) {
            log.error("No workflows were produced");
            return 1;
        }
        return hardFailure ? 1 : 0;
    }
}
