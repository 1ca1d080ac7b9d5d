package com.acme.identity.capl.ast;

import java.util.Optional;

/**
 * Built-in grant controls and their output spelling.
 */
public enum GrantControl {
    MFA("MFA", "mfa"),
    COMPLIANT_DEVICE("CompliantDevice", "compliantDevice"),
    HYBRID_JOINED("HybridJoined", "domainJoinedDevice"),
    APPROVED_APP("ApprovedApp", "approvedApplication"),
    APP_PROTECTION("AppProtection", "compliantApplication"),
    PASSWORD_CHANGE("PasswordChange", "passwordChange");

    public static final String BLOCK_CONTROL = "block";

    private final String keyword;
    private final String wireValue;

    GrantControl(String keyword, String wireValue) {
        this.keyword = keyword;
        this.wireValue = wireValue;
    }

    public String keyword() {
        return keyword;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<GrantControl> fromKeyword(String word) {
        for (GrantControl c : values()) {
            if (c.keyword.equals(word)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
