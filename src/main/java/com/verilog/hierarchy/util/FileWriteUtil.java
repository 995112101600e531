package com.verilog.hierarchy.util;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for report file output with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        createParentDirectories(filePath);
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Opens a writer that truncates the file, creating parent directories if needed.
     */
    public static BufferedWriter newWriter(Path filePath) throws IOException {
        createParentDirectories(filePath);
        return Files.newBufferedWriter(filePath, StandardCharsets.UTF_8);
    }

    public static boolean isBlank(Path filePath) throws IOException {
        return !Files.exists(filePath) || Files.size(filePath) == 0;
    }

    private static void createParentDirectories(Path filePath) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
    }
}
