package com.verilog.hierarchy.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.cli.model.ScanOptions;
import com.verilog.hierarchy.cli.model.ValidatedScanOptions;
import com.verilog.hierarchy.scan.ScanResult;

/**
 * Responsible only for printing CLI output for the scan command.
 * No validation, no execution.
 */
public class ScanResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ScanResultsPrinter.class);

    public void printBanner(ScanOptions o, ValidatedScanOptions v) {
        log.info("=================================================");
        log.info("Verilog Hierarchy Scanner");
        log.info("=================================================");
        if (v.getFiles().isEmpty() && o.getFileList() == null) {
            log.info("Sources: {}", "None (using module snapshot)");
        } else {
            log.info("Files: {}", v.getFiles().size());
            log.info("File List: {}", o.getFileList() != null ? o.getFileList().toAbsolutePath() : "None");
        }
        log.info("Module: {}", o.getModule() != null ? o.getModule() : "None");
        log.info("Search Under: {}", o.getScopeModule() != null ? o.getScopeModule() : "None");
        log.info("Max Depth: {}", o.getMaxDepth() == 0 ? "no limit" : o.getMaxDepth());
        log.info("Search Method: {} ({})", v.getSearchMethod().getCode(), v.getSearchMethod().getDescription());
        log.info("Print Unused: {}", o.isPrintUnused());
        log.info("Snapshot: {}", v.getDatabasePath());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(ScanResult result) {
        log.info("");
        log.info("=================================================");
        log.info("SCAN SUCCESSFUL");
        log.info("=================================================");
        if (result.isLoadedFromSnapshot()) {
            log.info("Modules Loaded From Snapshot: {}", result.getModulesRegistered());
        } else {
            log.info("Files Read: {}", result.getFilesIngested());
            if (result.getFilesMissing() > 0) {
                log.info("Files Missing: {}", result.getFilesMissing());
            }
            log.info("Modules Registered: {}", result.getModulesRegistered());
            log.info("Modules Defined More Than Once: {}", result.getConflictCount());
        }
        log.info("Hierarchy Entries: {}", result.getHierarchyEntries());
        if (result.getUnusedModules() > 0 || result.getUnusedFiles() > 0) {
            log.info("Unused Modules: {}", result.getUnusedModules());
            log.info("Unused Files: {}", result.getUnusedFiles());
        }
        log.info("Paths Found: {}", result.getPathsFound());

        if (!result.getReportFiles().isEmpty()) {
            log.info("");
            log.info("Report Files:");
            for (Path reportFile : result.getReportFiles()) {
                log.info("  {}", reportFile);
            }
        }
        if (!result.getWarnings().isEmpty()) {
            log.info("");
            log.info("Warnings:");
            for (String warning : result.getWarnings()) {
                log.info("  {}", warning);
            }
        }
        log.info("=================================================");
    }

    public void printFailure(ScanResult result) {
        log.error("Scan failed: {}", result.getErrorMessage());
    }
}
