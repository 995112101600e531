package com.verilog.hierarchy.parser;

import com.verilog.hierarchy.registry.ModuleRegistry;

/**
 * Lexical preprocessing for one file: comment removal followed by conditional
 * compilation filtering. Create one instance per file; defines live in the
 * registry and outlive it.
 */
public class LinePreprocessor {

    private final CommentStripper commentStripper = new CommentStripper();
    private final ConditionalFilter conditionalFilter;
    private final ConditionalState conditionalState = new ConditionalState();
    private CommentState commentState = CommentState.CODE;

    public LinePreprocessor(ModuleRegistry registry) {
        this.conditionalFilter = new ConditionalFilter(registry);
    }

    public String process(String rawLine) {
        StrippedLine stripped = commentStripper.strip(rawLine, commentState);
        commentState = stripped.endState();
        return conditionalFilter.filter(stripped.text(), conditionalState);
    }

    public boolean isInsideBlockComment() {
        return commentState == CommentState.BLOCK_COMMENT;
    }

    public ConditionalState getConditionalState() {
        return conditionalState;
    }
}
