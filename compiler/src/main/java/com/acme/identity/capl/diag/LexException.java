package com.acme.identity.capl.diag;

/**
 * Unrecognized input at the character level.
 */
public final class LexException extends CompileException {
    public LexException(ErrorCode code, String message, int line, String sourceText) {
        super(Diagnostic.of(code, message, line, sourceText));
    }
}
