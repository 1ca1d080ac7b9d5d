package com.acme.identity.capl.diag;

/**
 * Same value both included and excluded within one category on a single path.
 */
public final class ContradictionException extends CompileException {
    public ContradictionException(ErrorCode code, String message, int line, String sourceText) {
        super(Diagnostic.of(code, message, line, sourceText));
    }
}
