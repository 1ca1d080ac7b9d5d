package com.acme.identity.capl.diag;

/**
 * Grammar violation, tagged with the violated rule.
 */
public final class SyntaxException extends CompileException {
    public SyntaxException(ErrorCode code, String message, int line, String sourceText) {
        super(Diagnostic.of(code, message, line, sourceText));
    }
}
