package com.verilog.hierarchy.parser;

/**
 * Removes line and block comments from source lines.
 *
 * Single left-to-right pass per line. The only state carried between lines is
 * whether a block comment is still open.
 */
public class CommentStripper {

    static final String LINE_COMMENT = "//";
    static final String BLOCK_OPEN = "/*";
    static final String BLOCK_CLOSE = "*/";

    /**
     * Vendor marker that would otherwise be read as the start of a block comment.
     */
    static final String UNBLOCK_MARKER = "//*";

    public StrippedLine strip(String line, CommentState startState) {
        String text = line;
        if (startState == CommentState.CODE) {
            while (text.contains(UNBLOCK_MARKER)) {
                text = text.replace(UNBLOCK_MARKER, LINE_COMMENT);
            }
        }

        StringBuilder kept = new StringBuilder(text.length());
        CommentState state = startState;
        int cursor = 0;

        while (cursor < text.length()) {
            if (state == CommentState.BLOCK_COMMENT) {
                int close = text.indexOf(BLOCK_CLOSE, cursor);
                if (close < 0) {
                    cursor = text.length();
                } else {
                    cursor = close + BLOCK_CLOSE.length();
                    state = CommentState.CODE;
                }
                continue;
            }

            int blockOpen = text.indexOf(BLOCK_OPEN, cursor);
            int lineComment = text.indexOf(LINE_COMMENT, cursor);

            if (lineComment >= 0 && (blockOpen < 0 || lineComment < blockOpen)) {
                kept.append(text, cursor, lineComment);
                cursor = text.length();
            } else if (blockOpen >= 0) {
                kept.append(text, cursor, blockOpen);
                cursor = blockOpen + BLOCK_OPEN.length();
                state = CommentState.BLOCK_COMMENT;
            } else {
                kept.append(text, cursor, text.length());
                cursor = text.length();
            }
        }

        return new StrippedLine(kept.toString(), state);
    }
}
