package com.verilog.hierarchy.parser;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * What a single file contributed to the registry.
 */
@Value
@Builder
public class FileIngestResult {

    @NonNull
    String filePath;

    int lineCount;

    /**
     * Modules registered by this file, in source order.
     */
    @Singular
    List<String> registeredModules;

    /**
     * Modules from this file whose names were already taken.
     */
    @Singular
    List<String> duplicateModules;

    public int getModuleCount() {
        return registeredModules.size() + duplicateModules.size();
    }
}
