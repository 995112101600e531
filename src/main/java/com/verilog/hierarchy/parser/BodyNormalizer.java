package com.verilog.hierarchy.parser;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Flattens a module's lines into one single-spaced string with parameter blocks
 * ({@code #( ... )}) and event controls ({@code @( ... )}) cut out.
 */
public class BodyNormalizer {

    static final String PARAMETER_OPENER = "#(";
    static final String EVENT_OPENER = "@(";

    private static final Pattern SPACE_RUN = Pattern.compile(" {2,}");

    public String normalize(List<String> lines) {
        StringBuilder joined = new StringBuilder();
        for (String line : lines) {
            joined.append(line).append('\n');
        }

        String text = joined.toString()
                .replace('\n', ' ')
                .replace('\t', ' ')
                .replace(", ", ",")
                .replace("# (", "#(");

        text = elideBalanced(text, PARAMETER_OPENER);
        text = elideBalanced(text, EVENT_OPENER);

        return SPACE_RUN.matcher(text).replaceAll(" ");
    }

    /**
     * Repeatedly removes the first {@code opener} together with everything up to
     * its matching close parenthesis. An unclosed span runs to the end of the text.
     */
    static String elideBalanced(String text, String opener) {
        String result = text;
        int start = result.indexOf(opener);
        while (start >= 0) {
            int end = balancedEnd(result, start + opener.length());
            result = result.substring(0, start) + result.substring(end);
            start = result.indexOf(opener);
        }
        return result;
    }

    private static int balancedEnd(String text, int from) {
        int depth = 1;
        int cursor = from;
        while (cursor < text.length()) {
            char c = text.charAt(cursor);
            if (c == ')') {
                depth--;
            } else if (c == '(') {
                depth++;
            }
            cursor++;
            if (depth == 0) {
                return cursor;
            }
        }
        return text.length();
    }
}
