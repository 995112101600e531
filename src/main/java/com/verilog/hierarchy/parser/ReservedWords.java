package com.verilog.hierarchy.parser;

import java.util.List;
import java.util.Set;

import lombok.experimental.UtilityClass;

/**
 * Words that can never name an instance or an instantiated module type.
 * Order matters for prefix stripping.
 */
@UtilityClass
public class ReservedWords {

    public static final List<String> ALL = List.of(
            "if", "else",
            "begin", "end",
            "case", "endcase",
            "generate", "endgenerate",
            "initial",
            "wire",
            "logic",
            "parameter",
            "localparam",
            "assign",
            "always",
            "always_ff",
            "for",
            "$display",
            "$finish",
            "@"
    );

    private static final Set<String> LOOKUP = Set.copyOf(ALL);

    public static boolean isReserved(String word) {
        return LOOKUP.contains(word);
    }
}
