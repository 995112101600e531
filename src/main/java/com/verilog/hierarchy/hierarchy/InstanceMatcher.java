package com.verilog.hierarchy.hierarchy;

import com.verilog.hierarchy.model.Instance;

/**
 * Predicate selecting the instances a reverse path search starts from.
 */
@FunctionalInterface
public interface InstanceMatcher {

    boolean matches(Instance instance);
}
