package com.acme.identity.capl.ast;

import java.util.Optional;

public enum SessionKind {
    SIGN_IN_FREQUENCY("signin-frequency"),
    PERSISTENT_BROWSER("persistent-browser"),
    CLOUD_APP_SECURITY("monitor"),
    APP_ENFORCED_RESTRICTIONS("block-downloads");

    private final String keyword;

    SessionKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<SessionKind> fromKeyword(String word) {
        for (SessionKind k : values()) {
            if (k.keyword.equals(word)) {
                return Optional.of(k);
            }
        }
        return Optional.empty();
    }
}
