package com.verilog.hierarchy.hierarchy;

import lombok.NonNull;
import lombok.Value;

/**
 * One line of a hierarchy tree. Depth 1 is a direct child of the root.
 */
@Value
public class HierarchyEntry {

    int depth;

    @NonNull
    String instanceName;

    @NonNull
    String typeName;

    public String label() {
        return instanceName + " (" + typeName + ")";
    }
}
