package com.verilog.hierarchy.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.model.SourceLocation;

/**
 * Groups filtered lines of one file into per-module batches.
 *
 * A second module header seen before endmodule renames the open module but
 * keeps the lines buffered so far.
 */
public class ModuleBoundaryTracker {
    private static final Logger log = LoggerFactory.getLogger(ModuleBoundaryTracker.class);

    static final String MODULE_KEYWORD = "module";
    static final String END_KEYWORD = "endmodule";

    private enum State {
        IDLE,
        IN_MODULE
    }

    private final String filePath;
    private final List<String> buffer = new ArrayList<>();
    private State state = State.IDLE;
    private String moduleName;
    private int startLine;
    private int startColumn;

    public ModuleBoundaryTracker(String filePath) {
        this.filePath = filePath;
    }

    /**
     * Feed the next filtered line.
     *
     * @return the completed module when this line closes one
     * @throws VerilogParseException on endmodule outside a module
     */
    public Optional<ModuleSource> accept(String line, int lineNumber) {
        if (line.contains(END_KEYWORD)) {
            if (state == State.IDLE) {
                throw new VerilogParseException(filePath, lineNumber,
                        "endmodule detected before a 'module' definition was established");
            }
            log.debug("End of module '{}' on line {}", moduleName, lineNumber);
            buffer.add(line);
            ModuleSource source = new ModuleSource(moduleName,
                    SourceLocation.builder()
                            .filePath(filePath)
                            .line(startLine)
                            .column(startColumn)
                            .build(),
                    List.copyOf(buffer));
            buffer.clear();
            state = State.IDLE;
            return Optional.of(source);
        }

        if (isModuleHeader(line)) {
            int nameStart = nameStart(line);
            moduleName = readName(line, nameStart);
            startLine = lineNumber;
            startColumn = nameStart + moduleName.length() + 1;
            log.debug("Reading in module '{}' on line {}", moduleName, lineNumber);
            state = State.IN_MODULE;
            buffer.add(line);
        } else if (state == State.IN_MODULE) {
            buffer.add(line);
        }
        return Optional.empty();
    }

    /**
     * Call once the file is exhausted.
     *
     * @throws VerilogParseException when a module is still open
     */
    public void finish(int lastLineNumber) {
        if (state == State.IN_MODULE) {
            throw new VerilogParseException(filePath, lastLineNumber,
                    "module '" + moduleName + "' did not have a corresponding endmodule");
        }
    }

    public boolean isInModule() {
        return state == State.IN_MODULE;
    }

    static boolean isModuleHeader(String line) {
        String trimmed = line.strip();
        return trimmed.startsWith(MODULE_KEYWORD + " ")
                || trimmed.startsWith(MODULE_KEYWORD + "\t")
                || line.contains(" " + MODULE_KEYWORD + " ");
    }

    /**
     * Index of the first character of the module name in {@code line}.
     */
    static int nameStart(String line) {
        String trimmed = line.strip();
        int keyword;
        if (trimmed.startsWith(MODULE_KEYWORD + " ") || trimmed.startsWith(MODULE_KEYWORD + "\t")) {
            keyword = line.indexOf(MODULE_KEYWORD);
        } else {
            keyword = line.indexOf(" " + MODULE_KEYWORD + " ") + 1;
        }
        int cursor = keyword + MODULE_KEYWORD.length();
        while (cursor < line.length() && Character.isWhitespace(line.charAt(cursor))) {
            cursor++;
        }
        return cursor;
    }

    static String readName(String line, int nameStart) {
        int cursor = nameStart;
        while (cursor < line.length()) {
            char c = line.charAt(cursor);
            if (Character.isWhitespace(c) || c == '(' || c == ';') {
                break;
            }
            cursor++;
        }
        return line.substring(nameStart, cursor);
    }

    static String extractModuleName(String line) {
        return readName(line, nameStart(line));
    }
}
