package com.verilog.hierarchy.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Per-file conditional compilation state: the stack of pending `ifdef-style
 * tokens and whether the innermost scope is currently visible.
 */
public class ConditionalState {

    private final Deque<String> pending = new ArrayDeque<>();
    private boolean visible;

    void push(String token) {
        pending.push(token);
    }

    Optional<String> pop() {
        return Optional.ofNullable(pending.poll());
    }

    Optional<String> top() {
        return Optional.ofNullable(pending.peek());
    }

    void setVisible(boolean visible) {
        this.visible = visible;
    }

    public boolean isVisible() {
        return visible;
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    public int depth() {
        return pending.size();
    }

    /**
     * Pending tokens, innermost first.
     */
    public List<String> pendingTokens() {
        return List.copyOf(pending);
    }

    /**
     * True when plain source lines should be kept.
     */
    public boolean passesSource() {
        return visible || pending.isEmpty();
    }
}
