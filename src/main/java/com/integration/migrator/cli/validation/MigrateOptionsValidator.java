package com.integration.migrator.cli.validation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import com.integration.migrator.cli.exception.OptionsValidationException;
import com.integration.migrator.cli.model.MigrateOptions;
import com.integration.migrator.cli.model.ValidatedMigrateOptions;

public class MigrateOptionsValidator {

	public ValidatedMigrateOptions validate(MigrateOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> sources = o.getSources() == null ? List.of() : o.getSources();

		if (sources.isEmpty() && o.getBindings() == null) {
			errors.add("At least one --source / -s or a --bindings / -b file is required.");
		}

		List<Path> normalizedSources = new ArrayList<>();
		for (Path source : sources) {
			if (!existsFile(source)) {
				errors.add("Source file does not exist or is not a file: " + source);
			} else {
				normalizedSources.add(source.toAbsolutePath().normalize());
			}
		}

		if (o.getBindings() != null && !existsFile(o.getBindings())) {
			errors.add("Binding file does not exist or is not a file: " + o.getBindings());
		}

		Path normalizedOutputDir = null;
		if (o.getOutputDir() == null) {
			errors.add("Output directory is required (--output-dir / -o).");
		} else {
			normalizedOutputDir = o.getOutputDir().toAbsolutePath().normalize();
			if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
				errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
			} else if (isNonEmptyDirectory(normalizedOutputDir) && !o.isForce()) {
				errors.add("Output directory is not empty: " + normalizedOutputDir + ". Use --force to overwrite.");
			}
		}

		if (o.getParallelism() < 1) {
			errors.add("Parallelism must be >= 1. Got: " + o.getParallelism());
		}
		if (o.getRetryLimit() < 1) {
			errors.add("Retry limit must be >= 1. Got: " + o.getRetryLimit());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path reportFile = o.getReport() == null ? null : o.getReport().toAbsolutePath().normalize();
		return new ValidatedMigrateOptions(sources.isEmpty(), List.copyOf(normalizedSources), normalizedOutputDir,
				reportFile);
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.isRegularFile(p);
	}

	private static boolean isNonEmptyDirectory(Path p) {
		if (!Files.isDirectory(p)) {
			return false;
		}
		try (Stream<Path> entries = Files.list(p)) {
			return entries.findAny().isPresent();
		} catch (IOException e) {
			throw new UncheckedIOException("Cannot list output directory " + p, e);
		}
	}
}
