package com.acme.identity.capl.ast;

import java.util.Map;
import java.util.Optional;

/**
 * Closed set of condition domains. Each category knows its source keyword, which operators it accepts and
 * how its literal values are spelled in the output record.
 */
public enum Category {
    USER("user", true, Map.of(
        "All", "All",
        "Guest", "GuestsOrExternalUsers",
        "None", "None"
    )),
    APPLICATION("app", true, Map.of(
        "All", "All",
        "Office365", "Office365",
        "None", "None"
    )),
    PLATFORM("platform", false, Map.of(
        "All", "all",
        "iOS", "iOS",
        "Android", "android",
        "Windows", "windows",
        "macOS", "macOS",
        "Linux", "linux",
        "WindowsPhone", "windowsPhone"
    )),
    DEVICE("device", false, Map.of(
        "Compliant", "compliant",
        "HybridJoined", "domainJoined"
    )),
    LOCATION("location", true, Map.of(
        "All", "All",
        "Trusted", "AllTrusted"
    )),
    CLIENT("client", false, Map.of(
        "All", "all",
        "Browser", "browser",
        "MobileApp", "mobileAppsAndDesktopClients",
        "DesktopApp", "mobileAppsAndDesktopClients",
        "ExchangeActiveSync", "exchangeActiveSync",
        "Other", "other"
    )),
    SIGN_IN_RISK("signin-risk", false, Map.of(
        "High", "high",
        "Medium", "medium",
        "Low", "low",
        "None", "none"
    )),
    USER_RISK("user-risk", false, Map.of(
        "High", "high",
        "Medium", "medium",
        "Low", "low",
        "None", "none"
    ));

    private final String keyword;
    private final boolean membership;
    private final Map<String, String> literals;

    Category(String keyword, boolean membership, Map<String, String> literals) {
        this.keyword = keyword;
        this.membership = membership;
        this.literals = literals;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Whether {@code in} and named entities ({@code "Name" [id]}) are accepted.
     */
    public boolean supportsMembership() {
        return membership;
    }

    public boolean isLiteral(String word) {
        return literals.containsKey(word);
    }

    public Optional<String> wireLiteral(String word) {
        return Optional.ofNullable(literals.get(word));
    }

    public static Optional<Category> fromKeyword(String word) {
        if (word == null) {
            return Optional.empty();
        }
        if (word.equals("application")) {
            return Optional.of(APPLICATION);
        }
        for (Category c : values()) {
            if (c.keyword.equals(word)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
