package com.verilog.hierarchy.snapshot;

import java.util.List;

import com.verilog.hierarchy.model.VerilogModule;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * On-disk document of {@link JsonSnapshotStore}.
 */
@Value
@Builder
@Jacksonized
public class ModuleSnapshot {

    int formatVersion;

    @NonNull
    List<VerilogModule> modules;
}
