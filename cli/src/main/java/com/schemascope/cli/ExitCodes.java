package com.schemascope.cli;

/**
 * Process exit codes, one per error class.
 */
public final class ExitCodes {
    private ExitCodes() {}

    public static final int OK = 0;
    public static final int INVALID_CONFIGURATION = 1;
    public static final int CONNECTION_FAILED = 2;
    public static final int EXTRACTION_FAILED = 3;
    public static final int OUTPUT_FAILED = 4;
}
