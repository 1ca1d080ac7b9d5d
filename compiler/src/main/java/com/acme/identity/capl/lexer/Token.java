package com.acme.identity.capl.lexer;

import java.util.Objects;

/**
 * Lexical token. {@code lexeme} holds the unquoted content for strings and bracket identifiers.
 * {@code line} and {@code column} are 1-based.
 */
public record Token(TokenKind kind, String lexeme, int line, int column) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(lexeme, "lexeme");
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isKeyword(String keyword) {
        return kind == TokenKind.KEYWORD && lexeme.equals(keyword);
    }

    public boolean isIdentifier(String word) {
        return kind == TokenKind.IDENTIFIER && lexeme.equals(word);
    }

    public String describe() {
        return switch (kind) {
            case NEWLINE -> "end of line";
            case EOF -> "end of input";
            case STRING -> "\"" + lexeme + "\"";
            case BRACKET_IDENTIFIER -> "[" + lexeme + "]";
            default -> "'" + lexeme + "'";
        };
    }
}
