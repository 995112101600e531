package com.verilog.hierarchy.filelist;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.util.FileWriteUtil;

/**
 * Writes a copy of a file list without the source files whose modules were all
 * unused. Include directories are always kept; comments and non-files are dropped.
 */
public class MinimizedFileListWriter {
    private static final Logger log = LoggerFactory.getLogger(MinimizedFileListWriter.class);

    public static final String FILE_NAME = "minimized_filelist.f";

    /**
     * @return number of source files kept
     */
    public int write(List<FileListEntry> entries, Collection<String> unusedFiles, Path target) throws IOException {
        Set<String> unused = new HashSet<>();
        for (String file : unusedFiles) {
            unused.add(normalize(file));
        }

        int kept = 0;
        try (BufferedWriter writer = FileWriteUtil.newWriter(target)) {
            for (FileListEntry entry : entries) {
                if (entry.isSourceFile()) {
                    if (!unused.contains(normalize(entry.getResolvedPath()))) {
                        writer.write(entry.getRawLine());
                        writer.newLine();
                        kept++;
                    }
                } else if (entry.getKind() == FileListEntry.Kind.INCLUDE_DIR) {
                    writer.write(entry.getRawLine());
                    writer.newLine();
                }
            }
        }
        log.info("wrote {} with {} source files", target, kept);
        return kept;
    }

    private static String normalize(String file) {
        return Path.of(file).toString();
    }
}
