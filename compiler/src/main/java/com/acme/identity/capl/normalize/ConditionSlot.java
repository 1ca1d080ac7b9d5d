package com.acme.identity.capl.normalize;

/**
 * Output slots a condition lands in. Slots without exclude support have a flat list in the output record.
 */
public enum ConditionSlot {
    USERS(true),
    USER_GROUPS(true),
    USER_ROLES(true),
    APPLICATIONS(true),
    PLATFORMS(true),
    DEVICE_STATES(true),
    LOCATIONS(true),
    CLIENT_APP_TYPES(false),
    SIGN_IN_RISK(false),
    USER_RISK(false);

    private final boolean supportsExclude;

    ConditionSlot(boolean supportsExclude) {
        this.supportsExclude = supportsExclude;
    }

    public boolean supportsExclude() {
        return supportsExclude;
    }
}
