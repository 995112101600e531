package com.verilog.hierarchy;

import com.verilog.hierarchy.cli.ScanCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Verilog Hierarchy Scanner.
 * This CLI tool reads Verilog sources, keeps a snapshot of the modules it found,
 * and reports on module hierarchies and instance paths.
 */
public class HierarchyScannerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ScanCommand()).execute(args);
        System.exit(exitCode);
    }
}
