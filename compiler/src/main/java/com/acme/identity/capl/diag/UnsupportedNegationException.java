package com.acme.identity.capl.diag;

/**
 * Negated condition on a category whose output slot cannot express an exclusion.
 */
public final class UnsupportedNegationException extends CompileException {
    public UnsupportedNegationException(ErrorCode code, String message, int line, String sourceText) {
        super(Diagnostic.of(code, message, line, sourceText));
    }
}
