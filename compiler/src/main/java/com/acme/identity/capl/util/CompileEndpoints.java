package com.acme.identity.capl.util;

/**
 * HTTP route and content-type constants for the compile endpoint.
 */
public final class CompileEndpoints {
    public static final String COMPILE_PATH = "/v1/compile";
    public static final String HEALTH_PATH = "/healthz";

    public static final String JSON = "application/json";
    public static final String TEXT_PLAIN = "text/plain";

    private CompileEndpoints() {
    }

    public static String stripQuery(String uri) {
        int q = uri.indexOf('?');
        return q >= 0 ? uri.substring(0, q) : uri;
    }

    public static boolean isJson(String contentType) {
        return startsWithIgnoreCase(contentType, JSON);
    }

    public static boolean isPlainText(String contentType) {
        return startsWithIgnoreCase(contentType, TEXT_PLAIN);
    }

    private static boolean startsWithIgnoreCase(String value, String prefix) {
        if (value == null || value.length() < prefix.length()) {
            return false;
        }
        return value.regionMatches(true, 0, prefix, 0, prefix.length());
    }
}
