package com.verilog.hierarchy.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the scan command line entry point.
 */
class ScanCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testScanWritesReports() throws IOException {
        Path top = Files.writeString(tempDir.resolve("top.v"), "module top;\n  leaf u0 (.a(a));\nendmodule\n");
        Path leaf = Files.writeString(tempDir.resolve("leaf.v"), "module leaf(input a);\nendmodule\n");

        int exitCode = new CommandLine(new ScanCommand()).execute(
                "-f", top.toString(), leaf.toString(),
                "-m", "leaf",
                "-r", "top",
                "--database", tempDir.resolve("modules.json").toString(),
                "-o", tempDir.resolve("reports").toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(tempDir.resolve("reports/leaf_under_top.txt"))).containsExactly("top.u0");
        assertThat(Files.readAllLines(tempDir.resolve("reports/hierarchy_leaf.txt"))).containsExactly("leaf");
    }

    @Test
    void testInvalidOptionsExitWithOne() {
        int exitCode = new CommandLine(new ScanCommand()).execute(
                "--max-depth", "-2",
                "--database", tempDir.resolve("modules.json").toString(),
                "-o", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testStructuralErrorExitsWithOne() throws IOException {
        Path bad = Files.writeString(tempDir.resolve("bad.v"), "endmodule\n");

        int exitCode = new CommandLine(new ScanCommand()).execute(
                "-f", bad.toString(),
                "--database", tempDir.resolve("modules.json").toString(),
                "-o", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }
}
