package com.verilog.hierarchy.scan.context;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Errors, warnings and infos accumulated during one scan run.
 *
 * Pure structure only: the scanner logs as it goes.
 */
@Getter
public class ScanDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
