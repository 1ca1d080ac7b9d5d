package com.acme.identity.capl.ast;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum BranchState {
    ENABLED("enabled"),
    DISABLED("disabled"),
    REPORT_ONLY("report-only");

    private final String keyword;

    BranchState(String keyword) {
        this.keyword = keyword;
    }

    @JsonValue
    public String keyword() {
        return keyword;
    }

    public static Optional<BranchState> fromKeyword(String word) {
        for (BranchState s : values()) {
            if (s.keyword.equals(word)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
