package com.acme.identity.capl.ast;

/**
 * Qualifier of a {@code user in ...} condition. All other conditions use {@link #NONE}.
 */
public enum MemberKind {
    NONE,
    GROUP,
    ROLE
}
