package com.acme.identity.capl.diag;

/**
 * Rule tags carried by diagnostics. Each tag belongs to exactly one {@link DiagnosticKind}.
 */
public enum ErrorCode {
    UNRECOGNIZED_CHARACTER(DiagnosticKind.LEX_ERROR),
    UNTERMINATED_STRING(DiagnosticKind.LEX_ERROR),
    UNTERMINATED_BRACKET(DiagnosticKind.LEX_ERROR),

    UNEXPECTED_TOKEN(DiagnosticKind.SYNTAX_ERROR),
    MISSING_STATE(DiagnosticKind.SYNTAX_ERROR),
    MISSING_END(DiagnosticKind.SYNTAX_ERROR),
    MISSING_ACTION(DiagnosticKind.SYNTAX_ERROR),
    ACTION_BEFORE_STATE(DiagnosticKind.SYNTAX_ERROR),
    CONDITION_AFTER_STATE(DiagnosticKind.SYNTAX_ERROR),
    MIXED_PAYLOAD(DiagnosticKind.SYNTAX_ERROR),
    DUPLICATE_ELSE(DiagnosticKind.SYNTAX_ERROR),
    INVALID_STATE(DiagnosticKind.SYNTAX_ERROR),
    UNKNOWN_CATEGORY(DiagnosticKind.SYNTAX_ERROR),
    UNSUPPORTED_OPERATOR(DiagnosticKind.SYNTAX_ERROR),
    MALFORMED_VALUE(DiagnosticKind.SYNTAX_ERROR),
    CROSS_CATEGORY_OR(DiagnosticKind.SYNTAX_ERROR),
    OR_OPERATOR_MISMATCH(DiagnosticKind.SYNTAX_ERROR),
    GRANT_OR_CHAIN_TOO_LONG(DiagnosticKind.SYNTAX_ERROR),
    MALFORMED_VAR(DiagnosticKind.SYNTAX_ERROR),
    MALFORMED_SESSION(DiagnosticKind.SYNTAX_ERROR),
    NESTING_TOO_DEEP(DiagnosticKind.SYNTAX_ERROR),

    UNDECLARED_VARIABLE(DiagnosticKind.SEMANTIC_ERROR),
    VARIABLE_USED_BEFORE_DECLARATION(DiagnosticKind.SEMANTIC_ERROR),
    DUPLICATE_VARIABLE(DiagnosticKind.SEMANTIC_ERROR),
    EMPTY_IDENTIFIER(DiagnosticKind.SEMANTIC_ERROR),
    EMPTY_CONDITION_LIST(DiagnosticKind.SEMANTIC_ERROR),
    UNKNOWN_LITERAL(DiagnosticKind.SEMANTIC_ERROR),
    CONFLICTING_ACTIONS(DiagnosticKind.SEMANTIC_ERROR),
    MALFORMED_GRANT_COMBINATION(DiagnosticKind.SEMANTIC_ERROR),
    DUPLICATE_SESSION_CONTROL(DiagnosticKind.SEMANTIC_ERROR),
    DUPLICATE_POLICY_NAME(DiagnosticKind.SEMANTIC_ERROR),

    CONTRADICTORY_CONDITION(DiagnosticKind.CONTRADICTION_ERROR),

    NEGATION_NOT_SUPPORTED(DiagnosticKind.UNSUPPORTED_NEGATION_ERROR);

    private final DiagnosticKind kind;

    ErrorCode(DiagnosticKind kind) {
        this.kind = kind;
    }

    public DiagnosticKind kind() {
        return kind;
    }
}
