package com.acme.identity.capl.compiler;

import java.util.Objects;

public record UnitResult(SourceUnit unit, CompileResult result) {
    public UnitResult {
        Objects.requireNonNull(unit, "unit");
        Objects.requireNonNull(result, "result");
    }
}
