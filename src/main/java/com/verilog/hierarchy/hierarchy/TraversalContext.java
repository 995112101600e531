package com.verilog.hierarchy.hierarchy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Module names on the current recursion path of a traversal.
 *
 * With the guard off this only tracks depth and never refuses a step, so a
 * cyclic hierarchy recurses until a depth limit or stack exhaustion.
 */
final class TraversalContext {

    private final Deque<String> activeModules = new ArrayDeque<>();
    private final boolean cycleGuard;

    TraversalContext(boolean cycleGuard) {
        this.cycleGuard = cycleGuard;
    }

    /**
     * @return false when the guard is on and {@code moduleName} is already on the path
     */
    boolean enter(String moduleName) {
        if (cycleGuard && activeModules.contains(moduleName)) {
            return false;
        }
        activeModules.push(moduleName);
        return true;
    }

    void leave() {
        activeModules.pop();
    }

    /**
     * Active modules, outermost first.
     */
    List<String> path() {
        List<String> path = new ArrayList<>(activeModules);
        Collections.reverse(path);
        return path;
    }
}
