package com.acme.identity.capl.diag;

/**
 * Top-level error taxonomy of the compiler.
 */
public enum DiagnosticKind {
    LEX_ERROR,
    SYNTAX_ERROR,
    SEMANTIC_ERROR,
    CONTRADICTION_ERROR,
    UNSUPPORTED_NEGATION_ERROR
}
