package com.acme.identity.capl.diag;

/**
 * Well-formed source with an invalid meaning: unresolved references, illegal action combinations.
 */
public final class SemanticException extends CompileException {
    public SemanticException(ErrorCode code, String message, int line, String sourceText) {
        super(Diagnostic.of(code, message, line, sourceText));
    }
}
