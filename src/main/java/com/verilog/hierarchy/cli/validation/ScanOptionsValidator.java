package com.verilog.hierarchy.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.verilog.hierarchy.cli.exception.OptionsValidationException;
import com.verilog.hierarchy.cli.model.ScanOptions;
import com.verilog.hierarchy.cli.model.ValidatedScanOptions;
import com.verilog.hierarchy.hierarchy.SearchMethod;

public class ScanOptionsValidator {

	public ValidatedScanOptions validate(ScanOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getMaxDepth() < 0) {
			errors.add("Max depth must be >= 0. Got: " + o.getMaxDepth());
		}

		Optional<SearchMethod> searchMethod = SearchMethod.fromCode(o.getSearchMethod());
		if (searchMethod.isEmpty()) {
			errors.add("Search method must be 1, 2 or 3. Got: " + o.getSearchMethod());
		}

		if (o.getSeparator() == null || o.getSeparator().isEmpty()) {
			errors.add("Separator must not be empty (--separator).");
		}

		if (!isBlank(o.getScopeModule()) && isBlank(o.getModule())) {
			errors.add("--report-hier / -r requires a module to search for (--module / -m).");
		}

		// Missing -f files only produce warnings; a missing file list cannot be read at all
		if (o.getFileList() != null && !Files.isRegularFile(o.getFileList())) {
			errors.add("File list does not exist or is not a file: " + o.getFileList());
		}

		if (o.getOutputDir() != null && Files.exists(o.getOutputDir()) && !Files.isDirectory(o.getOutputDir())) {
			errors.add("Output directory is not a directory: " + o.getOutputDir());
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();

		Path databasePath = (o.getDatabasePath() == null ? Path.of("verilog_modules.json") : o.getDatabasePath())
				.toAbsolutePath().normalize();
		if (Files.isDirectory(databasePath)) {
			errors.add("Database path is a directory: " + databasePath);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		List<Path> files = o.getFiles() == null ? List.of() : List.copyOf(o.getFiles());
		return new ValidatedScanOptions(files, searchMethod.get(), normalizedOutputDir, databasePath);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
