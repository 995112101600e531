package com.verilog.hierarchy.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.hierarchy.HierarchyReport;
import com.verilog.hierarchy.model.ModuleConflict;
import com.verilog.hierarchy.model.ModuleSummary;
import com.verilog.hierarchy.util.FileWriteUtil;

/**
 * Writes the auxiliary text reports into the output directory.
 */
public class ReportWriter {
    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    public static final String MULTI_DEFINED_FILE = "multi_defined_module_list.txt";
    public static final String UNUSED_MODULES_FILE = "unused_modules.txt";
    public static final String UNUSED_FILES_FILE = "unused_files.txt";

    private final ReportTemplates templates;
    private final Path outputDir;

    public ReportWriter(ReportTemplates templates, Path outputDir) {
        this.templates = Objects.requireNonNull(templates, "templates");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }

    public static String hierarchyFileName(String rootModule) {
        return "hierarchy_" + rootModule + ".txt";
    }

    public static String pathSearchFileName(String target, String scopeModule) {
        return target + "_under_" + scopeModule + ".txt";
    }

    public Path resolve(String fileName) {
        return outputDir.resolve(fileName);
    }

    public String renderModuleSummary(ModuleSummary summary) {
        return templates.render(ReportTemplates.MODULE_SUMMARY, Map.of("module", summary));
    }

    /**
     * Replaces any previous multi-defined report. The file is only written when
     * there are conflicts.
     *
     * @return true when no module was defined more than once
     */
    public boolean writeMultiDefined(List<ModuleConflict> conflicts) throws IOException {
        Path target = resolve(MULTI_DEFINED_FILE);
        Files.deleteIfExists(target);

        if (conflicts.isEmpty()) {
            log.info("No modules defined more than once!");
            return true;
        }

        for (ModuleConflict conflict : conflicts) {
            log.warn("module {} defined at {} was previously defined", conflict.getModuleName(), conflict.getLocation());
        }
        FileWriteUtil.safeWriteString(target, templates.render(ReportTemplates.MULTI_DEFINED, Map.of("conflicts", conflicts)));
        return false;
    }

    public Path writeUnusedModules(HierarchyReport report) throws IOException {
        Path target = resolve(UNUSED_MODULES_FILE);
        FileWriteUtil.safeWriteString(target,
                templates.render(ReportTemplates.UNUSED_MODULES, Map.of("modules", report.getUnusedModules())));
        return target;
    }

    public Path writeUnusedFiles(HierarchyReport report) throws IOException {
        Path target = resolve(UNUSED_FILES_FILE);
        FileWriteUtil.safeWriteString(target,
                templates.render(ReportTemplates.UNUSED_FILES, Map.of("files", report.getUnusedFiles())));
        return target;
    }
}
