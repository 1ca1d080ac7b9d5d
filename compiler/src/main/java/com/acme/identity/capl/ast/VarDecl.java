package com.acme.identity.capl.ast;

import java.util.Objects;

/**
 * {@code VAR Name = "Display label" [identifier]}.
 */
public record VarDecl(String name, String label, String identifier, int line) {
    public VarDecl {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(identifier, "identifier");
    }
}
