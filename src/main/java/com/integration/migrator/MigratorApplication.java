package com.integration.migrator;

import com.integration.migrator.cli.MigrateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Orchestration Workflow Migrator.
 * This CLI tool converts BizTalk orchestrations and binding files into
 * workflow action graphs and a Markdown migration report.
 */
public class MigratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MigrateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
