package com.verilog.hierarchy.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Where a module definition starts. Column points just past the module name,
 * which is what editors expect for file:line:col navigation.
 */
@Value
@Builder
@Jacksonized
public class SourceLocation {

    @NonNull
    String filePath;

    int line;

    int column;

    @Override
    public String toString() {
        return filePath + ":" + line + ":" + column;
    }
}
