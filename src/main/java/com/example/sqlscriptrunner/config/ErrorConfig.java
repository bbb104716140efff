package com.example.sqlscriptrunner.config;

public final class ErrorConfig {
    private ErrorConfig() {}
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
    public static final String SCRIPT_READ_FAILED = "SCRIPT_READ_FAILED";
    public static final String NO_STATEMENTS = "NO_STATEMENTS";
    public static final String EXECUTION_FAILED = "EXECUTION_FAILED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
