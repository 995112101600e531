package com.verilog.hierarchy.parser;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.verilog.hierarchy.registry.ModuleRegistry;

/**
 * Applies `ifdef / `ifndef / `else / `endif / `protected / `endprotected and
 * records `define names in the registry.
 *
 * Visibility only looks at the innermost pending token. Directive lines never
 * reach the output.
 */
public class ConditionalFilter {
    private static final Logger log = LoggerFactory.getLogger(ConditionalFilter.class);

    static final String PROTECTED_TOKEN = "protected";

    private enum Directive {
        IFDEF("`ifdef"),
        PROTECTED("`protected"),
        IFNDEF("`ifndef"),
        ENDIF("`endif"),
        ENDPROTECTED("`endprotected"),
        ELSE("`else"),
        DEFINE("`define");

        private final String prefix;

        Directive(String prefix) {
            this.prefix = prefix;
        }

        static Optional<Directive> match(String normalizedLine) {
            for (Directive directive : values()) {
                if (normalizedLine.startsWith(directive.prefix)) {
                    return Optional.of(directive);
                }
            }
            return Optional.empty();
        }
    }

    private final ModuleRegistry registry;

    public ConditionalFilter(ModuleRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param text  a line with comments already removed
     * @param state conditional state of the file being read, updated in place
     * @return the line unchanged when visible, otherwise the empty string
     */
    public String filter(String text, ConditionalState state) {
        String normalized = text.strip().replace('\t', ' ');
        Optional<Directive> directive = Directive.match(normalized);

        if (directive.isEmpty()) {
            return state.passesSource() ? text : "";
        }

        switch (directive.get()) {
            case IFDEF:
                state.push(lastToken(normalized));
                state.setVisible(isTopDefined(state));
                break;
            case PROTECTED:
                state.push(PROTECTED_TOKEN);
                state.setVisible(isTopDefined(state));
                break;
            case IFNDEF: {
                boolean emptyBeforePush = !state.hasPending();
                state.push(lastToken(normalized));
                state.setVisible(emptyBeforePush && !isTopDefined(state));
                break;
            }
            case ENDIF:
            case ENDPROTECTED:
                if (state.pop().isEmpty()) {
                    log.debug("Ignoring unbalanced {}", normalized);
                }
                state.setVisible(state.hasPending() && isTopDefined(state));
                break;
            case ELSE:
                state.setVisible(state.hasPending() && !isTopDefined(state));
                break;
            case DEFINE:
                if (state.passesSource()) {
                    String[] tokens = normalized.split(" ");
                    if (tokens.length >= 2) {
                        registry.define(tokens[1]);
                    }
                }
                break;
            default:
                break;
        }
        return "";
    }

    private boolean isTopDefined(ConditionalState state) {
        return state.top().map(registry::isDefined).orElse(false);
    }

    private static String lastToken(String normalized) {
        String[] tokens = normalized.split(" ");
        return tokens[tokens.length - 1];
    }
}
