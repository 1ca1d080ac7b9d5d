package com.acme.identity.capl.util;

/**
 * HTTP status codes and process exit codes used by the front ends.
 */
public final class StatusCodes {

    // ---- HTTP ----
    public static final int OK = 200;
    public static final int UNPROCESSABLE_ENTITY = 422;

    // ---- Process exit ----
    public static final int EXIT_OK = 0;
    public static final int EXIT_DIAGNOSTICS = 1;
    public static final int EXIT_USAGE = 2;

    private StatusCodes() {
    }
}
