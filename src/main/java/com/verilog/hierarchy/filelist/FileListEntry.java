package com.verilog.hierarchy.filelist;

import lombok.NonNull;
import lombok.Value;

/**
 * One line of a file list, classified.
 */
@Value
public class FileListEntry {

    public enum Kind {
        COMMENT,
        INCLUDE_DIR,
        SOURCE_FILE,
        /** Blank lines and entries that do not name an existing file. */
        NOT_A_FILE
    }

    /**
     * The line as written, without its line terminator.
     */
    @NonNull
    String rawLine;

    /**
     * Trimmed line with environment placeholders expanded.
     */
    @NonNull
    String resolvedPath;

    @NonNull
    Kind kind;

    public boolean isSourceFile() {
        return kind == Kind.SOURCE_FILE;
    }
}
