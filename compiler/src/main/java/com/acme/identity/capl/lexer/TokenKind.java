package com.acme.identity.capl.lexer;

public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    STRING,
    BRACKET_IDENTIFIER,
    NUMBER,
    EQUALS,
    COMMENT,
    NEWLINE,
    /** Placeholder for input the lexer already reported; the parser abandons the statement. */
    ERROR,
    EOF
}
