package com.verilog.hierarchy.parser;

import java.util.List;

import com.verilog.hierarchy.model.SourceLocation;

import lombok.NonNull;
import lombok.Value;

/**
 * The filtered lines of one module, from the line that opened it through its endmodule.
 */
@Value
public class ModuleSource {

    @NonNull
    String name;

    @NonNull
    SourceLocation location;

    @NonNull
    List<String> lines;
}
