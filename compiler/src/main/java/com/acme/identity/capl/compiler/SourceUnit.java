package com.acme.identity.capl.compiler;

import java.util.Objects;

/**
 * A named compile unit, typically one file without its extension.
 */
public record SourceUnit(String name, String source) {
    public SourceUnit {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
    }
}
