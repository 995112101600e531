package com.verilog.hierarchy.scan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a scan run.
 */
@Data
@Builder
public class ScanResult {
    private boolean success;
    private String errorMessage;

    private boolean loadedFromSnapshot;
    private int filesIngested;
    private int filesMissing;
    private int modulesRegistered;
    private int conflictCount;

    private int hierarchyEntries;
    private int unusedModules;
    private int unusedFiles;
    private int pathsFound;

    @Builder.Default
    private List<Path> reportFiles = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private long elapsedMillis;

    public static ScanResult failure(String errorMessage) {
        return ScanResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
