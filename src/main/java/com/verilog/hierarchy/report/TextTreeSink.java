package com.verilog.hierarchy.report;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.hierarchy.HierarchyEntry;
import com.verilog.hierarchy.hierarchy.HierarchySink;

/**
 * Writes the hierarchy tree as tab-indented text and mirrors it to the log
 * with "| " guides.
 */
public class TextTreeSink implements HierarchySink {
    private static final Logger log = LoggerFactory.getLogger(TextTreeSink.class);

    static final String FILE_INDENT = "\t";
    static final String CONSOLE_INDENT = "| ";

    private final Writer writer;

    public TextTreeSink(Writer writer) {
        this.writer = writer;
    }

    @Override
    public void onRoot(String rootModule, int maxDepth) {
        if (maxDepth != 0) {
            write("INFO : max_depth set to " + maxDepth + "\n\n");
        }
        log.info("{}", rootModule);
        write(rootModule + "\n");
    }

    @Override
    public void onInstance(HierarchyEntry entry) {
        log.info("{}{}", CONSOLE_INDENT.repeat(entry.getDepth()), entry.label());
        write(FILE_INDENT.repeat(entry.getDepth()) + entry.label() + "\n");
    }

    private void write(String text) {
        try {
            writer.write(text);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write hierarchy report", e);
        }
    }
}
