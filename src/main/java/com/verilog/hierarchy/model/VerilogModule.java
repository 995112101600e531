package com.verilog.hierarchy.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A module definition as recovered from source text.
 *
 * Built once when its endmodule is reached and never mutated afterwards.
 * An inout port appears in both the input and output lists.
 */
@Value
@Builder
@Jacksonized
public class VerilogModule {

    @NonNull
    String name;

    @Singular
    List<Port> inputs;

    @Singular
    List<Port> outputs;

    /**
     * Sub-instantiations in first-seen order. Duplicate instance names are kept.
     */
    @Singular
    List<Instance> instances;

    @NonNull
    SourceLocation location;
}
