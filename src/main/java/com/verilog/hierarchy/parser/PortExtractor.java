package com.verilog.hierarchy.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.verilog.hierarchy.model.Port;
import com.verilog.hierarchy.model.PortDirection;

/**
 * Finds port declarations in a normalized module body.
 *
 * Handles both ANSI headers ({@code input [7:0] a, b,}) and body declarations
 * ({@code output reg q;}). One port per declared name, all sharing the
 * direction and bit range of their declaration.
 */
public class PortExtractor {

    private static final Pattern PORT_PATTERN = Pattern.compile(
            "\\b(input|output|inout)\\s+(?:reg|logic|bit)?\\s*(?:(\\[[^\\]]*\\])\\s*)?(\\w+(?:\\s*,\\s*\\w+)*)\\s*[;,)]"
    );

    public List<Port> extract(String normalizedBody) {
        List<Port> ports = new ArrayList<>();
        Matcher matcher = PORT_PATTERN.matcher(normalizedBody);

        while (matcher.find()) {
            PortDirection direction = PortDirection.fromKeyword(matcher.group(1))
                    .orElseThrow(() -> new IllegalStateException("Unexpected port keyword: " + matcher.group(1)));
            String width = matcher.group(2) != null ? matcher.group(2).strip() : "";

            for (String name : matcher.group(3).split(",")) {
                ports.add(Port.builder()
                        .direction(direction)
                        .name(name.strip())
                        .width(width)
                        .build());
            }
        }
        return ports;
    }
}
