package com.verilog.hierarchy.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the scan command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ScanOptions {

	@Option(names = { "--file", "-f" }, arity = "1..*", description = "Verilog file(s) to read")
	private List<Path> files;

	@Option(names = { "--filelist", "-F" }, description = "File holding a list of Verilog files to read, one per line")
	private Path fileList;

	@Option(names = { "--module", "-m" }, description = "Module to describe and report the hierarchy of")
	private String module;

	@Option(names = { "--report-hier", "-r" }, description = "Module to search for the '-m' module under")
	private String scopeModule;

	@Option(names = { "--max-depth",
			"-M" }, defaultValue = "0", description = "Levels of hierarchy to report below the module (0 means no limit)")
	private int maxDepth;

	@Option(names = { "--search-method",
			"-s" }, defaultValue = "1", description = "Path search: 1 exact type, 2 type contains, 3 instance name contains (default: 1)")
	private int searchMethod;

	@Option(names = { "--print-unused", "-u" }, description = "Report modules and files that were read in but unused")
	private boolean printUnused;

	@Option(names = { "--debug", "-d" }, description = "Print per-module extraction details")
	private boolean debug;

	@Option(names = {
			"--separator" }, defaultValue = ".", description = "Separator between instance names in found paths (default: .)")
	private String separator;

	@Option(names = {
			"--database" }, defaultValue = "verilog_modules.json", description = "Module snapshot file (default: verilog_modules.json)")
	private Path databasePath;

	@Option(names = { "--output-dir", "-o" }, description = "Directory for report files (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--cycle-guard" }, description = "Do not re-enter a module already on the current path")
	private boolean cycleGuard;

}
