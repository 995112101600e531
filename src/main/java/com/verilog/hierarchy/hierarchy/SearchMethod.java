package com.verilog.hierarchy.hierarchy;

import java.util.Arrays;
import java.util.Optional;

/**
 * How the target of a reverse path search is compared against instances.
 */
public enum SearchMethod {
    EXACT_TYPE(1, "the module type is"),
    TYPE_CONTAINS(2, "the module type contains the string"),
    INSTANCE_NAME_CONTAINS(3, "the instance name contains the string");

    private final int code;
    private final String description;

    SearchMethod(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Only an exact type search needs its target to be a registered module.
     */
    public boolean targetsModuleType() {
        return this == EXACT_TYPE;
    }

    public InstanceMatcher matcher(String target) {
        switch (this) {
            case TYPE_CONTAINS:
                return instance -> instance.getTypeName().contains(target);
            case INSTANCE_NAME_CONTAINS:
                return instance -> instance.getInstanceName().contains(target);
            case EXACT_TYPE:
            default:
                return instance -> instance.getTypeName().equals(target);
        }
    }

    public static Optional<SearchMethod> fromCode(int code) {
        return Arrays.stream(values())
                .filter(m -> m.code == code)
                .findFirst();
    }
}
