package com.verilog.hierarchy.scan;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.verilog.hierarchy.hierarchy.ReversePathFinder;
import com.verilog.hierarchy.hierarchy.SearchMethod;
import com.verilog.hierarchy.snapshot.JsonSnapshotStore;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one scan run.
 */
@Data
@Builder
public class ScannerConfig {

    @Builder.Default
    private List<Path> files = List.of();

    private Path fileList;

    /**
     * Root of the hierarchy report, and the search target.
     */
    private String module;

    /**
     * Module to search for {@link #module} under.
     */
    private String scopeModule;

    private int maxDepth;

    @Builder.Default
    private SearchMethod searchMethod = SearchMethod.EXACT_TYPE;

    private boolean printUnused;

    @Builder.Default
    private String separator = ReversePathFinder.DEFAULT_SEPARATOR;

    @Builder.Default
    private Path databasePath = Path.of(JsonSnapshotStore.DEFAULT_FILE_NAME);

    @Builder.Default
    private Path outputDir = Path.of(".");

    private boolean cycleGuard;

    /**
     * Variables used to expand {@code $NAME} in source paths and file list entries.
     */
    @Builder.Default
    private Map<String, String> environment = System.getenv();

    /**
     * True when sources are given, meaning the snapshot is rebuilt instead of loaded.
     */
    public boolean hasSources() {
        return (files != null && !files.isEmpty()) || fileList != null;
    }

    public boolean hasModule() {
        return module != null && !module.isEmpty();
    }

    public boolean hasScopeModule() {
        return scopeModule != null && !scopeModule.isEmpty();
    }
}
