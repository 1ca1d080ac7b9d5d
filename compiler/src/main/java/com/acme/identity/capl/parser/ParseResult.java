package com.acme.identity.capl.parser;

import com.acme.identity.capl.ast.Program;
import com.acme.identity.capl.diag.Diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * Statements that parsed cleanly, plus one diagnostic per statement that did not.
 */
public record ParseResult(Program program, List<Diagnostic> diagnostics) {
    public ParseResult {
        Objects.requireNonNull(program, "program");
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }
}
