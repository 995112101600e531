package com.verilog.hierarchy.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single declared port of a module.
 */
@Value
@Builder
@Jacksonized
public class Port {

    @NonNull
    PortDirection direction;

    @NonNull
    String name;

    /**
     * Bit range exactly as written (e.g. "[7:0]"), empty when the port is scalar.
     */
    @NonNull
    @Builder.Default
    String width = "";

    @Override
    public String toString() {
        return "[" + direction.getKeyword() + ", " + name + ", " + width + "]";
    }
}
