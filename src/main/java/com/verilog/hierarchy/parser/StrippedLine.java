package com.verilog.hierarchy.parser;

/**
 * Text of one line with comments removed, plus the comment state the next line starts in.
 */
public record StrippedLine(String text, CommentState endState) {

    public boolean endsInsideBlockComment() {
        return endState == CommentState.BLOCK_COMMENT;
    }
}
