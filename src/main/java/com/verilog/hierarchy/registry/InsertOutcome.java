package com.verilog.hierarchy.registry;

/**
 * Result of offering a module definition to the registry.
 */
public enum InsertOutcome {
    INSERTED,
    CONFLICT_RECORDED
}
