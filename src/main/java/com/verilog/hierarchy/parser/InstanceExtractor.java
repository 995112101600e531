package com.verilog.hierarchy.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.verilog.hierarchy.model.Instance;

/**
 * Recognizes sub-instantiations in a normalized module body.
 *
 * This is a permissive heuristic, not a grammar: any statement whose text before
 * the first parenthesis is exactly two plain tokens, neither reserved, counts as
 * {@code <type> <name>(...)}. Two-token task or function calls are accepted as well.
 */
public class InstanceExtractor {

    /**
     * Characters that rule out a type/name pair.
     */
    static final String FORBIDDEN_CHARACTERS = "=:.[]$<> ";

    private enum Clause {
        /** The defining "module name ..." clause of the module itself. */
        MODULE_HEADER,
        /** wire / assign statements, not modeled. */
        UNMODELED_STATEMENT,
        /** Text before a parenthesis that may be an instantiation. */
        CANDIDATE,
        /** Nothing left that could hold an instantiation. */
        NO_CANDIDATE
    }

    public List<Instance> extract(String moduleName, String body) {
        List<Instance> instances = new ArrayList<>();
        String header = ModuleBoundaryTracker.MODULE_KEYWORD + " " + moduleName;
        int cursor = 0;

        while (cursor < body.length()) {
            Clause clause = classify(body, cursor, header);
            if (clause == Clause.CANDIDATE) {
                int paren = body.indexOf('(', cursor);
                recognize(body.substring(cursor, paren)).ifPresent(instances::add);
            }
            cursor = pastNextSemicolon(body, cursor);
        }
        return instances;
    }

    private Clause classify(String body, int cursor, String header) {
        if (body.indexOf(header, cursor) >= 0) {
            return Clause.MODULE_HEADER;
        }
        if (body.startsWith("wire ", cursor) || body.startsWith("assign ", cursor)) {
            return Clause.UNMODELED_STATEMENT;
        }
        if (body.indexOf('(', cursor) >= 0) {
            return Clause.CANDIDATE;
        }
        return Clause.NO_CANDIDATE;
    }

    /**
     * Decides whether the text in front of a parenthesis is {@code <type> <name>}.
     */
    Optional<Instance> recognize(String candidate) {
        String span = stripReservedPrefixes(candidate);
        if (span.indexOf(';') >= 0) {
            return Optional.empty();
        }

        String pair = span.strip();
        int split = pair.indexOf(' ');
        String typeName = pair.substring(0, split + 1).strip();
        String instanceName = pair.substring(split + 1).strip();

        if (typeName.isEmpty() || instanceName.isEmpty()) {
            return Optional.empty();
        }
        if (ReservedWords.isReserved(typeName) || ReservedWords.isReserved(instanceName)) {
            return Optional.empty();
        }
        if (containsForbidden(typeName + instanceName)) {
            return Optional.empty();
        }
        return Optional.of(Instance.of(typeName, instanceName));
    }

    /**
     * Drops leading reserved words such as "end else begin " until none is left.
     */
    static String stripReservedPrefixes(String candidate) {
        String span = candidate;
        boolean stripped;
        do {
            stripped = false;
            for (String word : ReservedWords.ALL) {
                String prefix = word + " ";
                if (span.strip().startsWith(prefix)) {
                    span = span.substring(span.indexOf(prefix) + prefix.length());
                    stripped = true;
                }
            }
        } while (stripped);
        return span;
    }

    private static boolean containsForbidden(String text) {
        for (int i = 0; i < FORBIDDEN_CHARACTERS.length(); i++) {
            if (text.indexOf(FORBIDDEN_CHARACTERS.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static int pastNextSemicolon(String body, int cursor) {
        int semicolon = body.indexOf(';', cursor);
        return semicolon >= 0 ? semicolon + 1 : body.length();
    }
}
