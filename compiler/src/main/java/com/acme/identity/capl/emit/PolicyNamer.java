package com.acme.identity.capl.emit;

import com.acme.identity.capl.paths.PolicyPath;

import java.util.Objects;

/**
 * Builds {@code <prefix>-<index>-<trail>} display names. The leaf index keeps names distinct; the trail
 * (one token per branch level) keeps them traceable to the source. Truncation never cuts into the index.
 */
public final class PolicyNamer {
    private final String prefix;
    private final int maxLength;

    public PolicyNamer(String prefix, int maxLength) {
        String cleaned = sanitizePrefix(Objects.requireNonNull(prefix, "prefix"));
        this.prefix = cleaned.isEmpty() ? "Policy" : cleaned;
        this.maxLength = maxLength;
    }

    public String name(PolicyPath path) {
        String head = "-" + path.index();
        StringBuilder trail = new StringBuilder();
        for (String token : path.trail()) {
            String t = sanitizeToken(token);
            if (!t.isEmpty()) {
                trail.append('-').append(t);
            }
        }
        String full = prefix + head + trail;
        if (full.length() <= maxLength) {
            return full;
        }
        if (prefix.length() + head.length() <= maxLength) {
            String cut = full.substring(0, maxLength);
            return cut.endsWith("-") ? cut.substring(0, cut.length() - 1) : cut;
        }
        return prefix.substring(0, Math.max(1, maxLength - head.length())) + head;
    }

    public String prefix() {
        return prefix;
    }

    static String sanitizeToken(String token) {
        StringBuilder sb = new StringBuilder(token.length());
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (isAsciiAlnum(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String sanitizePrefix(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (isAsciiAlnum(c) || c == '-') {
                sb.append(c);
            } else if (c == ' ' || c == '_' || c == '.') {
                sb.append('-');
            }
        }
        int start = 0;
        int end = sb.length();
        while (start < end && sb.charAt(start) == '-') {
            start++;
        }
        while (end > start && sb.charAt(end - 1) == '-') {
            end--;
        }
        return sb.substring(start, end);
    }

    private static boolean isAsciiAlnum(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }
}
