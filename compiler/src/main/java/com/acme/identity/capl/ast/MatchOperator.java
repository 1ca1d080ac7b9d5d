package com.acme.identity.capl.ast;

public enum MatchOperator {
    IS("is"),
    IN("in");

    private final String keyword;

    MatchOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
