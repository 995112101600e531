package com.verilog.hierarchy.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.verilog.hierarchy.hierarchy.SearchMethod;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the scanner. Keeps ScanCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedScanOptions {
    List<Path> files;
    SearchMethod searchMethod;
    Path normalizedOutputDir;
    Path databasePath;
}
