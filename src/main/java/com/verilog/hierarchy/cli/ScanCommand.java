package com.verilog.hierarchy.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.cli.exception.OptionsValidationException;
import com.verilog.hierarchy.cli.model.ScanOptions;
import com.verilog.hierarchy.cli.model.ValidatedScanOptions;
import com.verilog.hierarchy.cli.output.ScanResultsPrinter;
import com.verilog.hierarchy.cli.validation.ScanOptionsValidator;
import com.verilog.hierarchy.scan.HierarchyScanner;
import com.verilog.hierarchy.scan.ScanResult;
import com.verilog.hierarchy.scan.ScannerConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that scans Verilog sources and reports on the module hierarchy.
 */
@Command(
        name = "verilog-hierarchy",
        mixinStandardHelpOptions = true,
        version = "verilog-hierarchy-scanner 1.0.0",
        description = "Extracts modules, ports and instances from Verilog sources and reports on the instance hierarchy."
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    static final String BASE_LOGGER = "com.verilog.hierarchy";

    @Mixin
    private ScanOptions options = new ScanOptions();

    private final ScanOptionsValidator validator = new ScanOptionsValidator();
    private final ScanResultsPrinter printer = new ScanResultsPrinter();

    @Override
    public Integer call() {
        try {
            if (options.isDebug()) {
                enableDebugLogging();
            }

            ValidatedScanOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            ScanResult result = new HierarchyScanner(toConfig(validated)).run();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }

            printer.printSuccess(result);
            return 0;

        } catch (OptionsValidationException e) {
            for (String error : e.getErrors()) {
                log.error("{}", error);
            }
            return 1;
        } catch (Exception e) {
            log.error("Scan failed with exception", e);
            return 1;
        }
    }

    ScannerConfig toConfig(ValidatedScanOptions validated) {
        return ScannerConfig.builder()
                .files(validated.getFiles())
                .fileList(options.getFileList())
                .module(options.getModule())
                .scopeModule(options.getScopeModule())
                .maxDepth(options.getMaxDepth())
                .searchMethod(validated.getSearchMethod())
                .printUnused(options.isPrintUnused())
                .separator(options.getSeparator())
                .databasePath(validated.getDatabasePath())
                .outputDir(validated.getNormalizedOutputDir())
                .cycleGuard(options.isCycleGuard())
                .build();
    }

    private void enableDebugLogging() {
        Logger baseLogger = LoggerFactory.getLogger(BASE_LOGGER);
        if (baseLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
            log.debug("debug logging enabled");
        } else {
            log.warn("--debug has no effect, logging backend is not Logback");
        }
    }
}
