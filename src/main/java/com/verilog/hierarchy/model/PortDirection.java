package com.verilog.hierarchy.model;

import java.util.Optional;

/**
 * Direction keyword of a module port.
 */
public enum PortDirection {
    INPUT("input"),
    OUTPUT("output"),
    INOUT("inout");

    private final String keyword;

    PortDirection(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean feedsInputs() {
        return this == INPUT || this == INOUT;
    }

    public boolean feedsOutputs() {
        return this == OUTPUT || this == INOUT;
    }

    public static Optional<PortDirection> fromKeyword(String keyword) {
        for (PortDirection direction : values()) {
            if (direction.keyword.equals(keyword)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }
}
