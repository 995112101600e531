package com.verilog.hierarchy.hierarchy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Parameters of one hierarchy report.
 */
@Value
@Builder
public class HierarchyRequest {

    @NonNull
    String rootModule;

    /**
     * Levels below the root to report; 0 means no limit.
     */
    int maxDepth;

    boolean reportUnused;

    /**
     * Skip re-entering a module already on the current path. Off by default.
     */
    boolean cycleGuard;
}
