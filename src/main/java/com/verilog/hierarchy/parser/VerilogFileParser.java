package com.verilog.hierarchy.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.model.VerilogModule;
import com.verilog.hierarchy.registry.InsertOutcome;
import com.verilog.hierarchy.registry.ModuleRegistry;

/**
 * Reads Verilog source files into a {@link ModuleRegistry}.
 *
 * Files must be ingested one after another: `define names collected from one
 * file are visible to every file read after it.
 */
public class VerilogFileParser {
    private static final Logger log = LoggerFactory.getLogger(VerilogFileParser.class);

    private final ModuleRegistry registry;
    private final ModuleAssembler assembler;

    public VerilogFileParser(ModuleRegistry registry) {
        this(registry, new ModuleAssembler());
    }

    public VerilogFileParser(ModuleRegistry registry, ModuleAssembler assembler) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    /**
     * Parse one file and register its modules.
     *
     * @throws NoSuchFileException   when {@code path} is not a regular file
     * @throws VerilogParseException on inconsistent module/endmodule nesting
     */
    public FileIngestResult ingestFile(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }

        log.info("reading in {} ...", path);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8))) {
            return ingest(path.toString(), reader);
        }
    }

    /**
     * Parse in-memory source text as if it had been read from {@code sourceName}.
     */
    public FileIngestResult ingestText(String sourceName, String text) {
        try (BufferedReader reader = new BufferedReader(new StringReader(text))) {
            return ingest(sourceName, reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private FileIngestResult ingest(String filePath, BufferedReader reader) throws IOException {
        LinePreprocessor preprocessor = new LinePreprocessor(registry);
        ModuleBoundaryTracker tracker = new ModuleBoundaryTracker(filePath);
        FileIngestResult.FileIngestResultBuilder result = FileIngestResult.builder().filePath(filePath);

        int lineNumber = 0;
        String rawLine;
        while ((rawLine = reader.readLine()) != null) {
            lineNumber++;
            String filtered = preprocessor.process(rawLine);
            tracker.accept(filtered, lineNumber).ifPresent(source -> {
                VerilogModule module = assembler.assemble(source);
                if (registry.insert(module) == InsertOutcome.INSERTED) {
                    result.registeredModule(module.getName());
                } else {
                    result.duplicateModule(module.getName());
                }
            });
        }
        tracker.finish(lineNumber);

        return result.lineCount(lineNumber).build();
    }
}
