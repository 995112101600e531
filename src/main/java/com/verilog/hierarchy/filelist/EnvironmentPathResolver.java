package com.verilog.hierarchy.filelist;

import java.io.File;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands {@code $NAME} placeholders in paths. A placeholder runs from the
 * {@code $} to the next path separator; unset variables expand to nothing. A
 * placeholder in the last path component is left alone.
 */
public class EnvironmentPathResolver {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentPathResolver.class);

    private final Map<String, String> environment;
    private final String separator;

    public EnvironmentPathResolver() {
        this(System.getenv(), File.separator);
    }

    public EnvironmentPathResolver(Map<String, String> environment) {
        this(environment, File.separator);
    }

    public EnvironmentPathResolver(Map<String, String> environment, String separator) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.separator = Objects.requireNonNull(separator, "separator");
    }

    public String resolve(String path) {
        String resolved = path;
        int start = resolved.indexOf('$');
        int end = start >= 0 ? resolved.indexOf(separator, start) : -1;

        while (start >= 0 && end >= 0) {
            String name = resolved.substring(start + 1, end);
            String value = environment.getOrDefault(name, "");
            log.debug("replacing ${} with {}", name, value);

            resolved = resolved.substring(0, start) + value + resolved.substring(end);
            start = resolved.indexOf('$');
            end = start >= 0 ? resolved.indexOf(separator, start) : -1;
        }
        return resolved;
    }
}
