package com.verilog.hierarchy.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A definition of an already registered module name. The first definition is the
 * one kept; this only records where the later one was found.
 */
@Value
@Builder
public class ModuleConflict {

    @NonNull
    String moduleName;

    @NonNull
    SourceLocation location;
}
