package com.verilog.hierarchy.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Read-only view of a module's raw attributes, handed to reporting callers.
 */
@Value
@Builder
public class ModuleSummary {

    @NonNull
    String name;

    @NonNull
    List<Port> inputs;

    @NonNull
    List<Port> outputs;

    @NonNull
    List<Instance> instances;

    @NonNull
    SourceLocation location;

    public static ModuleSummary from(VerilogModule module) {
        return ModuleSummary.builder()
                .name(module.getName())
                .inputs(module.getInputs())
                .outputs(module.getOutputs())
                .instances(module.getInstances())
                .location(module.getLocation())
                .build();
    }
}
