package com.integration.migrator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.integration.migrator.transform.TransformOptions;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "migrate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class MigrateOptions {

	@Option(names = { "--source", "-s" }, description = "Orchestration (.odx) file to migrate; repeat for a batch")
	private List<Path> sources = new ArrayList<>();

	@Option(names = { "--bindings", "-b" }, description = "Binding file describing receive locations and send ports")
	private Path bindings;

	@Option(names = { "--callable" }, description = "Start every workflow from a parent workflow call")
	private boolean callable;

	@Option(names = { "--output-dir", "-o" }, description = "Directory for the action graph JSON files")
	private Path outputDir;

	@Option(names = { "--report", "-r" }, description = "Path of the Markdown migration report")
	private Path report;

	@Option(names = { "--parallelism",
			"-p" }, defaultValue = "1", description = "Number of sources migrated concurrently (default: 1)")
	private int parallelism;

	@Option(names = {
			"--retry-limit" }, defaultValue = "" + TransformOptions.DEFAULT_RETRY_LIMIT, description = "Iteration cap for self-recursion retry loops (default: ${DEFAULT-VALUE})")
	private int retryLimit;

	@Option(names = { "--force", "-f" }, description = "Write into a non-empty output directory")
	private boolean force;

}
