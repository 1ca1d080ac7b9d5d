package com.acme.identity.capl.util;

/**
 * Canonical environment variable names.
 */
public final class CompilerEnvKeys {
    public static final String CAPL_NAME_PREFIX = "CAPL_NAME_PREFIX";
    public static final String CAPL_NAME_MAX_LENGTH = "CAPL_NAME_MAX_LENGTH";
    public static final String CAPL_COMPILER_WORKERS = "CAPL_COMPILER_WORKERS";
    public static final String CAPL_OUTPUT_FORMAT = "CAPL_OUTPUT_FORMAT";

    public static final String CAPL_INPUT_DIR = "CAPL_INPUT_DIR";
    public static final String CAPL_OUTPUT_DIR = "CAPL_OUTPUT_DIR";

    public static final String CAPL_HTTP_PORT = "CAPL_HTTP_PORT";
    public static final String CAPL_HTTP_MAX_SOURCE_BYTES = "CAPL_HTTP_MAX_SOURCE_BYTES";

    private CompilerEnvKeys() {
    }
}
