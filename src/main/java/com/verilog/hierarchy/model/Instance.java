package com.verilog.hierarchy.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One instantiation of a module type inside another module's body.
 */
@Value
@Builder
@Jacksonized
public class Instance {

    /**
     * Name of the instantiated module type.
     */
    @NonNull
    String typeName;

    @NonNull
    String instanceName;

    public static Instance of(String typeName, String instanceName) {
        return Instance.builder()
                .typeName(typeName)
                .instanceName(instanceName)
                .build();
    }

    @Override
    public String toString() {
        return "[" + typeName + ", " + instanceName + "]";
    }
}
