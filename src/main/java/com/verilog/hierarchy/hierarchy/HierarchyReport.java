package com.verilog.hierarchy.hierarchy;

import java.util.List;
import java.util.Set;

import com.verilog.hierarchy.model.VerilogModule;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of one hierarchy traversal. Scoped to the invocation that produced it.
 */
@Value
@Builder
public class HierarchyReport {

    @NonNull
    String rootModule;

    int maxDepth;

    @NonNull
    List<HierarchyEntry> entries;

    /**
     * Module types seen during the walk (plus the root when unused modules were requested).
     */
    @NonNull
    Set<String> usedModules;

    /**
     * Files of every module that was found and expanded.
     */
    @NonNull
    Set<String> usedFiles;

    /**
     * Registered modules never reached. Empty unless unused modules were requested.
     */
    @NonNull
    List<VerilogModule> unusedModules;

    /**
     * Files holding only unreached modules, each listed once.
     */
    @NonNull
    List<String> unusedFiles;

    boolean unusedRequested;
}
