package com.acme.identity.capl.util;

import java.util.Locale;
import java.util.Map;

/**
 * Environment parsing helpers with consistent defaulting and clamping. Blank counts as unset.
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    /**
     * Case-insensitive enum lookup; unknown values fall back to the default.
     */
    public static <E extends Enum<E>> E getEnum(Map<String, String> env, String name, Class<E> type, E defaultValue) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return defaultValue;
        }
    }
}
