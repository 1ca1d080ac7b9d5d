package com.acme.identity.capl.diag;

import java.util.Objects;

/**
 * Base of the compiler's checked error taxonomy. Every instance carries the diagnostic it reports.
 */
public abstract class CompileException extends Exception {
    private final Diagnostic diagnostic;

    protected CompileException(Diagnostic diagnostic) {
        super(Objects.requireNonNull(diagnostic, "diagnostic").message());
        this.diagnostic = diagnostic;
    }

    public Diagnostic diagnostic() {
        return diagnostic;
    }

    public ErrorCode code() {
        return diagnostic.code();
    }

    public int line() {
        return diagnostic.line();
    }
}
