package com.verilog.hierarchy.parser;

/**
 * Whether the scanner is inside a block comment at a given point of a file.
 */
public enum CommentState {
    CODE,
    BLOCK_COMMENT
}
