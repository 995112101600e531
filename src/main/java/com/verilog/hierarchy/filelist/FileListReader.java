package com.verilog.hierarchy.filelist;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a simulator-style file list (one path per line, {@code #} comments,
 * {@code +incdir+} include directories).
 */
public class FileListReader {
    private static final Logger log = LoggerFactory.getLogger(FileListReader.class);

    static final String COMMENT_PREFIX = "#";
    static final String INCDIR_PREFIX = "+incdir+";

    private final EnvironmentPathResolver pathResolver;

    public FileListReader(EnvironmentPathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    public List<FileListEntry> read(Path fileList) throws IOException {
        if (!Files.isRegularFile(fileList)) {
            throw new NoSuchFileException(fileList.toString(), null, "is not a file");
        }
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(fileList), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        return parse(lines);
    }

    public List<FileListEntry> parse(List<String> lines) {
        List<FileListEntry> entries = new ArrayList<>();
        for (String line : lines) {
            entries.add(classify(line));
        }
        return entries;
    }

    private FileListEntry classify(String line) {
        String trimmed = line.strip();
        if (trimmed.startsWith(COMMENT_PREFIX)) {
            return new FileListEntry(line, trimmed, FileListEntry.Kind.COMMENT);
        }

        String resolved = pathResolver.resolve(trimmed);
        if (!resolved.isEmpty() && Files.isRegularFile(Path.of(resolved))) {
            return new FileListEntry(line, resolved, FileListEntry.Kind.SOURCE_FILE);
        }
        if (resolved.startsWith(INCDIR_PREFIX)) {
            return new FileListEntry(line, resolved, FileListEntry.Kind.INCLUDE_DIR);
        }

        log.debug("{} is not a file", resolved);
        return new FileListEntry(line, resolved, FileListEntry.Kind.NOT_A_FILE);
    }
}
