package com.verilog.hierarchy.parser;

/**
 * Fatal structural error in a source file (module/endmodule nesting). Aborts the
 * ingestion run; there is no partial recovery.
 */
public class VerilogParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String filePath;
    private final int lineNumber;

    public VerilogParseException(String filePath, int lineNumber, String message) {
        super(filePath + ":" + lineNumber + ": " + message);
        this.filePath = filePath;
        this.lineNumber = lineNumber;
    }

    public String getFilePath() {
        return filePath;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
