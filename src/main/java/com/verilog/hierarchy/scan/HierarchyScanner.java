package com.verilog.hierarchy.scan;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.filelist.EnvironmentPathResolver;
import com.verilog.hierarchy.filelist.FileListEntry;
import com.verilog.hierarchy.filelist.FileListReader;
import com.verilog.hierarchy.filelist.MinimizedFileListWriter;
import com.verilog.hierarchy.hierarchy.HierarchyReport;
import com.verilog.hierarchy.hierarchy.HierarchyReporter;
import com.verilog.hierarchy.hierarchy.HierarchyRequest;
import com.verilog.hierarchy.hierarchy.ReversePathFinder;
import com.verilog.hierarchy.hierarchy.SearchMethod;
import com.verilog.hierarchy.model.ModuleSummary;
import com.verilog.hierarchy.model.VerilogModule;
import com.verilog.hierarchy.parser.FileIngestResult;
import com.verilog.hierarchy.parser.VerilogFileParser;
import com.verilog.hierarchy.parser.VerilogParseException;
import com.verilog.hierarchy.registry.ModuleRegistry;
import com.verilog.hierarchy.report.ReportRenderingException;
import com.verilog.hierarchy.report.ReportTemplates;
import com.verilog.hierarchy.report.ReportWriter;
import com.verilog.hierarchy.report.TextTreeSink;
import com.verilog.hierarchy.scan.context.ScanDiagnostics;
import com.verilog.hierarchy.snapshot.JsonSnapshotStore;
import com.verilog.hierarchy.snapshot.SnapshotException;
import com.verilog.hierarchy.snapshot.SnapshotStore;
import com.verilog.hierarchy.util.FileWriteUtil;

/**
 * Runs one scan: builds or loads the module registry, then writes the
 * description, hierarchy, unused and path search reports for the selected module.
 */
public class HierarchyScanner {
    private static final Logger log = LoggerFactory.getLogger(HierarchyScanner.class);

    private static final String REPORT_RULE = "-------------------------------------";

    private final ScannerConfig config;
    private final ModuleRegistry registry;
    private final SnapshotStore snapshotStore;
    private final ReportWriter reportWriter;
    private final ScanDiagnostics diagnostics = new ScanDiagnostics();

    public HierarchyScanner(ScannerConfig config) {
        this(config, new ModuleRegistry(), new JsonSnapshotStore(config.getDatabasePath()));
    }

    public HierarchyScanner(ScannerConfig config, ModuleRegistry registry, SnapshotStore snapshotStore) {
        this.config = config;
        this.registry = registry;
        this.snapshotStore = snapshotStore;
        this.reportWriter = new ReportWriter(new ReportTemplates(), config.getOutputDir());
    }

    public ScanResult run() {
        long startTime = System.nanoTime();
        ScanResult.ScanResultBuilder result = ScanResult.builder();
        List<Path> reportFiles = new ArrayList<>();

        try {
            Files.createDirectories(config.getOutputDir());

            List<FileListEntry> fileListEntries = List.of();
            if (config.hasSources()) {
                log.info("Step 1: Reading Verilog sources...");
                fileListEntries = ingestSources(result);
                snapshotStore.save(registry.getModules());
                result.conflictCount(registry.getConflicts().size());
                if (!reportWriter.writeMultiDefined(registry.getConflicts())) {
                    reportFiles.add(reportWriter.resolve(ReportWriter.MULTI_DEFINED_FILE));
                }
            } else {
                log.info("Step 1: No file specified, loading module snapshot...");
                loadSnapshot();
                result.loadedFromSnapshot(true);
            }
            result.modulesRegistered(registry.size());

            if (!config.hasModule()) {
                log.info("No module selected for hierarchy reporting.");
            } else if (registry.isEmpty()) {
                log.info("No modules known, skipping reporting stage.");
                diagnostics.getInfos().add("No modules known, reports skipped");
            } else {
                log.info("Step 2: Reporting on module {}...", config.getModule());
                describeModule(config.getModule());
                HierarchyReport report = reportHierarchy(reportFiles);
                result.hierarchyEntries(report.getEntries().size());

                if (config.isPrintUnused()) {
                    result.unusedModules(report.getUnusedModules().size());
                    result.unusedFiles(report.getUnusedFiles().size());
                    reportFiles.add(reportWriter.writeUnusedModules(report));
                    reportFiles.add(reportWriter.writeUnusedFiles(report));
                    if (config.getFileList() != null) {
                        Path target = reportWriter.resolve(MinimizedFileListWriter.FILE_NAME);
                        new MinimizedFileListWriter().write(fileListEntries, report.getUnusedFiles(), target);
                        reportFiles.add(target);
                    }
                }

                if (config.hasScopeModule()) {
                    log.info("Step 3: Searching for instance paths...");
                    result.pathsFound(searchPaths(reportFiles));
                }
            }
        } catch (VerilogParseException e) {
            log.error("{}", e.getMessage());
            return finish(ScanResult.failure(e.getMessage()), startTime);
        } catch (IOException | UncheckedIOException e) {
            log.error("Scan failed with I/O error", e);
            return finish(ScanResult.failure("I/O error: " + e.getMessage()), startTime);
        } catch (SnapshotException | ReportRenderingException e) {
            log.error("Scan failed", e);
            return finish(ScanResult.failure(e.getMessage()), startTime);
        }

        ScanResult scanResult = result
                .success(!diagnostics.hasErrors())
                .errorMessage(diagnostics.hasErrors() ? String.join(System.lineSeparator(), diagnostics.getErrors()) : null)
                .reportFiles(reportFiles)
                .warnings(new ArrayList<>(diagnostics.getWarnings()))
                .build();
        return finish(scanResult, startTime);
    }

    public ModuleRegistry getRegistry() {
        return registry;
    }

    public ScanDiagnostics getDiagnostics() {
        return diagnostics;
    }

    private List<FileListEntry> ingestSources(ScanResult.ScanResultBuilder result) throws IOException {
        if (snapshotStore.delete()) {
            log.debug("removed previous snapshot");
        }
        registry.clear();

        EnvironmentPathResolver pathResolver = new EnvironmentPathResolver(config.getEnvironment());
        int ingested = 0;
        int missing = 0;
        for (Path file : config.getFiles()) {
            if (ingest(Path.of(pathResolver.resolve(file.toString())))) {
                ingested++;
            } else {
                missing++;
            }
        }

        List<FileListEntry> entries = List.of();
        if (config.getFileList() != null) {
            FileListReader reader = new FileListReader(pathResolver);
            entries = reader.read(config.getFileList());
            for (FileListEntry entry : entries) {
                if (!entry.isSourceFile()) {
                    continue;
                }
                if (ingest(Path.of(entry.getResolvedPath()))) {
                    ingested++;
                } else {
                    missing++;
                }
            }
        }

        log.info("Read {} files, {} modules registered", ingested, registry.size());
        result.filesIngested(ingested).filesMissing(missing);
        return entries;
    }

    /**
     * @return false when the file does not exist; the run continues without it
     */
    private boolean ingest(Path file) throws IOException {
        VerilogFileParser parser = new VerilogFileParser(registry);
        try {
            FileIngestResult ingested = parser.ingestFile(file);
            log.debug("{}: {} lines, modules {}, duplicates {}", ingested.getFilePath(), ingested.getLineCount(),
                    ingested.getRegisteredModules(), ingested.getDuplicateModules());
            return true;
        } catch (NoSuchFileException e) {
            log.warn("file {} does not exist, skipping it", file);
            diagnostics.getWarnings().add("Missing file: " + file);
            return false;
        }
    }

    private void loadSnapshot() {
        Optional<List<VerilogModule>> modules = snapshotStore.load();
        if (modules.isPresent()) {
            registry.replaceAll(modules.get());
            log.info("Loaded {} modules from snapshot", registry.size());
        } else {
            log.warn("No module snapshot found, nothing to report on");
            diagnostics.getWarnings().add("No module snapshot found");
        }
    }

    private void describeModule(String moduleName) {
        Optional<ModuleSummary> summary = registry.describe(moduleName);
        if (summary.isPresent()) {
            log.info("report on module {}...", moduleName);
            for (String line : reportWriter.renderModuleSummary(summary.get()).split("\n")) {
                log.info("{}", line);
            }
        } else {
            log.info(REPORT_RULE);
            log.error("module {} was not found.", moduleName);
            log.info(REPORT_RULE);
            diagnostics.getWarnings().add("Module not found: " + moduleName);
        }
    }

    private HierarchyReport reportHierarchy(List<Path> reportFiles) throws IOException {
        HierarchyRequest request = HierarchyRequest.builder()
                .rootModule(config.getModule())
                .maxDepth(config.getMaxDepth())
                .reportUnused(config.isPrintUnused())
                .cycleGuard(config.isCycleGuard())
                .build();

        Path target = reportWriter.resolve(ReportWriter.hierarchyFileName(config.getModule()));
        HierarchyReport report;
        try (BufferedWriter writer = FileWriteUtil.newWriter(target)) {
            report = new HierarchyReporter(registry).report(request, new TextTreeSink(writer));
        }
        reportFiles.add(target);
        return report;
    }

    private int searchPaths(List<Path> reportFiles) throws IOException {
        String target = config.getModule();
        String scope = config.getScopeModule();
        SearchMethod method = config.getSearchMethod();

        boolean scopeDefined = registry.contains(scope);
        boolean targetDefined = !method.targetsModuleType() || registry.contains(target);
        if (!scopeDefined || !targetDefined) {
            log.error("module specified in -m and/or -r option not defined");
            log.error("\t{} exists? {}", target, registry.contains(target));
            log.error("\t{} exists? {}", scope, scopeDefined);
            diagnostics.getErrors().add("Search modules not defined: " + target + " under " + scope);
            return 0;
        }

        Path reportFile = reportWriter.resolve(ReportWriter.pathSearchFileName(target, scope));
        ReversePathFinder finder = new ReversePathFinder(registry, config.getSeparator(), config.isCycleGuard());
        int found;
        try (BufferedWriter writer = FileWriteUtil.newWriter(reportFile)) {
            found = finder.find(method, target, scope, path -> {
                try {
                    writer.write(path);
                    writer.newLine();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        }

        if (FileWriteUtil.isBlank(reportFile)) {
            log.warn("No instances of {} found under {}", target, scope);
            log.warn("Removing file {} as it is blank ...", reportFile);
            Files.deleteIfExists(reportFile);
            diagnostics.getWarnings().add("No instances of " + target + " found under " + scope);
        } else {
            reportFiles.add(reportFile);
        }
        return found;
    }

    private ScanResult finish(ScanResult result, long startTime) {
        long elapsedMillis = (System.nanoTime() - startTime) / 1_000_000;
        result.setElapsedMillis(elapsedMillis);
        double seconds = elapsedMillis / 1000.0;
        log.info("Execution time = {} seconds", seconds);
        if (seconds > 60) {
            log.info("       ({} minutes)", (long) Math.floor(seconds / 60));
        }
        return result;
    }
}
