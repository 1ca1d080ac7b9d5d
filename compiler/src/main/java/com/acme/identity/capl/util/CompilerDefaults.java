package com.acme.identity.capl.util;

/**
 * Values used when the corresponding environment variable is not set.
 */
public final class CompilerDefaults {

    // ---- Naming ----
    public static final String NAME_PREFIX = "Generated";
    public static final int NAME_MAX_LENGTH = 256;
    public static final int NAME_MAX_LENGTH_MIN = 32;
    public static final int NAME_MAX_LENGTH_MAX = 256;

    // ---- Batch compilation ----
    public static final int WORKERS = 4;
    public static final int WORKERS_MIN = 1;
    public static final int WORKERS_MAX = 64;

    // ---- CLI ----
    public static final String INPUT_DIR = "PolicyLanguage";
    public static final String OUTPUT_DIR = "ConditionalAccessPolicies-Generated";
    public static final String SOURCE_EXTENSION = ".capl";
    public static final String REPORT_FILE = "compile-report.json";

    // ---- HTTP endpoint ----
    public static final int HTTP_PORT = 8085;
    public static final int MAX_SOURCE_BYTES = 1024 * 1024;
    public static final int MAX_SOURCE_BYTES_MIN = 1024;
    public static final int MAX_SOURCE_BYTES_MAX = 64 * 1024 * 1024;
    public static final int SO_BACKLOG = 128;

    private CompilerDefaults() {
    }
}
