package com.verilog.hierarchy.scan;

import com.verilog.hierarchy.hierarchy.SearchMethod;
import com.verilog.hierarchy.report.ReportWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete scan workflow.
 */
class HierarchyScannerTest {

    @TempDir
    Path tempDir;

    private Path outputDir;
    private Path database;
    private Path topFile;
    private Path leafFile;

    @BeforeEach
    void setUp() throws IOException {
        outputDir = tempDir.resolve("out");
        database = tempDir.resolve("verilog_modules.json");
        topFile = Files.writeString(tempDir.resolve("top.v"), """
                module top(input clk, output done);
                  leaf u0 (.clk(clk));
                endmodule
                """);
        leafFile = Files.writeString(tempDir.resolve("leaf.v"), """
                module leaf;
                endmodule
                """);
    }

    @Test
    void testHierarchyReportFromFiles() throws IOException {
        HierarchyScanner scanner = new HierarchyScanner(config()
                .files(List.of(topFile, leafFile))
                .module("top")
                .build());

        ScanResult result = scanner.run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesIngested()).isEqualTo(2);
        assertThat(result.getModulesRegistered()).isEqualTo(2);
        assertThat(result.getConflictCount()).isZero();
        assertThat(result.getHierarchyEntries()).isEqualTo(1);
        assertThat(Files.readString(outputDir.resolve("hierarchy_top.txt"))).isEqualTo("top\n\tu0 (leaf)\n");
        assertThat(outputDir.resolve(ReportWriter.MULTI_DEFINED_FILE)).doesNotExist();
        assertThat(database).exists();

        assertThat(scanner.getRegistry().describe("leaf")).hasValueSatisfying(leaf -> {
            assertThat(leaf.getInputs()).isEmpty();
            assertThat(leaf.getOutputs()).isEmpty();
            assertThat(leaf.getInstances()).isEmpty();
        });
    }

    @Test
    void testPathSearchUnderScope() throws IOException {
        ScanResult result = new HierarchyScanner(config()
                .files(List.of(topFile, leafFile))
                .module("leaf")
                .scopeModule("top")
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPathsFound()).isEqualTo(1);
        Path report = outputDir.resolve("leaf_under_top.txt");
        assertThat(Files.readAllLines(report)).containsExactly("top.u0");
        assertThat(result.getReportFiles()).contains(report);
    }

    @Test
    void testSecondRunLoadsSnapshot() {
        new HierarchyScanner(config().files(List.of(topFile, leafFile)).build()).run();

        ScanResult result = new HierarchyScanner(config()
                .module("top")
                .maxDepth(1)
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isLoadedFromSnapshot()).isTrue();
        assertThat(result.getModulesRegistered()).isEqualTo(2);
        assertThat(result.getHierarchyEntries()).isEqualTo(1);
    }

    @Test
    void testMultiDefinedReport() throws IOException {
        Path copy = Files.writeString(tempDir.resolve("leaf_copy.v"), "module leaf;\nendmodule\n");

        ScanResult result = new HierarchyScanner(config()
                .files(List.of(topFile, leafFile, copy))
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getConflictCount()).isEqualTo(1);
        assertThat(Files.readAllLines(outputDir.resolve(ReportWriter.MULTI_DEFINED_FILE)))
                .containsExactly("module leaf defined in " + copy + " was previously defined");
    }

    @Test
    void testMissingFileIsSkipped() {
        ScanResult result = new HierarchyScanner(config()
                .files(List.of(topFile, tempDir.resolve("missing.v"), leafFile))
                .module("top")
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesIngested()).isEqualTo(2);
        assertThat(result.getFilesMissing()).isEqualTo(1);
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("missing.v"));
    }

    @Test
    void testEnvironmentPlaceholderInSourcePath() throws IOException {
        Path rtl = Files.createDirectories(tempDir.resolve("rtl"));
        Files.copy(topFile, rtl.resolve("top.v"));
        Files.copy(leafFile, rtl.resolve("leaf.v"));

        ScanResult result = new HierarchyScanner(config()
                .files(List.of(Path.of("$RTL/top.v"), Path.of("$RTL/leaf.v")))
                .environment(Map.of("RTL", rtl.toString()))
                .module("top")
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesIngested()).isEqualTo(2);
        assertThat(result.getFilesMissing()).isZero();
        assertThat(Files.readString(outputDir.resolve("hierarchy_top.txt"))).isEqualTo("top\n\tu0 (leaf)\n");
    }

    @Test
    void testStructuralErrorFailsRun() throws IOException {
        Path broken = Files.writeString(tempDir.resolve("broken.v"), "module open_one;\nwire a;\n");

        ScanResult result = new HierarchyScanner(config()
                .files(List.of(topFile, broken))
                .module("top")
                .build()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("broken.v").contains("open_one");
    }

    @Test
    void testEmptySearchResultRemovesFile() {
        ScanResult result = new HierarchyScanner(config()
                .files(List.of(topFile, leafFile))
                .module("top")
                .scopeModule("leaf")
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPathsFound()).isZero();
        assertThat(outputDir.resolve("top_under_leaf.txt")).doesNotExist();
        assertThat(result.getWarnings()).anyMatch(w -> w.contains("No instances of top"));
    }

    @Test
    void testUndefinedScopeFailsRun() {
        ScanResult result = new HierarchyScanner(config()
                .files(List.of(topFile, leafFile))
                .module("leaf")
                .scopeModule("chip")
                .build()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("chip");
    }

    @Test
    void testSubstringSearchDoesNotNeedDefinedTarget() throws IOException {
        ScanResult result = new HierarchyScanner(config()
                .files(List.of(topFile, leafFile))
                .module("u")
                .scopeModule("top")
                .searchMethod(SearchMethod.INSTANCE_NAME_CONTAINS)
                .separator("/")
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(Files.readAllLines(outputDir.resolve("u_under_top.txt"))).containsExactly("top/u0");
    }

    @Test
    void testUnusedReportsAndMinimizedFileList() throws IOException {
        Path orphan = Files.writeString(tempDir.resolve("orphan.v"), "module orphan;\nendmodule\n");
        Path fileList = tempDir.resolve("files.f");
        Files.write(fileList, List.of(
                "# design",
                "+incdir+$ROOT/include",
                "$ROOT/top.v",
                "$ROOT/leaf.v",
                "$ROOT/orphan.v"));

        ScanResult result = new HierarchyScanner(config()
                .fileList(fileList)
                .environment(Map.of("ROOT", tempDir.toString()))
                .module("top")
                .printUnused(true)
                .build()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFilesIngested()).isEqualTo(3);
        assertThat(result.getUnusedModules()).isEqualTo(1);
        assertThat(Files.readAllLines(outputDir.resolve(ReportWriter.UNUSED_MODULES_FILE)))
                .containsExactly("module type orphan was unused (" + orphan + ":1:14)");
        assertThat(Files.readAllLines(outputDir.resolve(ReportWriter.UNUSED_FILES_FILE)))
                .containsExactly("No modules from this file were used : " + orphan);
        assertThat(Files.readAllLines(outputDir.resolve("minimized_filelist.f")))
                .containsExactly("+incdir+$ROOT/include", "$ROOT/top.v", "$ROOT/leaf.v");
    }

    @Test
    void testNoSourcesAndNoSnapshot() {
        HierarchyScanner scanner = new HierarchyScanner(config().module("top").build());

        ScanResult result = scanner.run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getModulesRegistered()).isZero();
        assertThat(result.getWarnings()).contains("No module snapshot found");
        assertThat(scanner.getDiagnostics().getInfos()).contains("No modules known, reports skipped");
        assertThat(scanner.getDiagnostics().hasErrors()).isFalse();
    }

    private ScannerConfig.ScannerConfigBuilder config() {
        return ScannerConfig.builder()
                .databasePath(database)
                .outputDir(outputDir)
                .environment(Map.of());
    }
}
