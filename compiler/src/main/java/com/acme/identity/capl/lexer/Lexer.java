package com.acme.identity.capl.lexer;

import com.acme.identity.capl.diag.Diagnostic;
import com.acme.identity.capl.diag.ErrorCode;
import com.acme.identity.capl.diag.LexException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Single-pass scanner for CAPL source.
 *
 * <p>Input is scanned by code point. Unrecognized input does not stop the scan: the {@link LexException}
 * is recorded as a diagnostic and the offending text becomes an {@link TokenKind#ERROR} token, so the
 * parser can drop the enclosing statement and continue.</p>
 */
public final class Lexer {
    public static final char COMMENT_MARKER = '#';

    static final Set<String> KEYWORDS = Set.of(
        "VAR", "IF", "ELSE", "END", "STATE", "OR", "NOT",
        "REQUIRE", "BLOCK", "ALLOW", "SESSION",
        "is", "in"
    );

    private final String src;
    private final List<String> lines;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int lineStart;

    private Lexer(String src) {
        this.src = src;
        this.lines = List.of(src.split("\r?\n", -1));
    }

    public static LexResult tokenize(String source) {
        Lexer lexer = new Lexer(source == null ? "" : source);
        lexer.run();
        return new LexResult(lexer.tokens, lexer.diagnostics, lexer.lines);
    }

    private void run() {
        while (pos < src.length()) {
            int start = pos;
            try {
                scanToken(src.codePointAt(pos));
            } catch (LexException e) {
                diagnostics.add(e.diagnostic());
                add(TokenKind.ERROR, src.substring(start, pos), start);
            }
        }
        add(TokenKind.EOF, "", pos);
    }

    private void scanToken(int cp) throws LexException {
        switch (cp) {
            case ' ', '\t', '\r', '\f' -> pos++;
            case '\n' -> {
                add(TokenKind.NEWLINE, "\n", pos);
                pos++;
                line++;
                lineStart = pos;
            }
            case COMMENT_MARKER -> scanComment();
            case '"' -> scanDelimited('"', TokenKind.STRING, ErrorCode.UNTERMINATED_STRING, "string");
            case '[' -> scanDelimited(']', TokenKind.BRACKET_IDENTIFIER, ErrorCode.UNTERMINATED_BRACKET, "bracket identifier");
            case '=' -> {
                add(TokenKind.EQUALS, "=", pos);
                pos++;
            }
            default -> {
                if (!isWordChar(cp)) {
                    pos += Character.charCount(cp);
                    throw lexError(ErrorCode.UNRECOGNIZED_CHARACTER,
                        "unrecognized character '" + new String(Character.toChars(cp)) + "'");
                }
                scanWord();
            }
        }
    }

    private void scanComment() {
        int start = pos;
        while (pos < src.length() && src.charAt(pos) != '\n') {
            pos++;
        }
        add(TokenKind.COMMENT, src.substring(start + 1, pos).trim(), start);
    }

    private void scanDelimited(char close, TokenKind kind, ErrorCode unterminated, String what) throws LexException {
        int start = pos;
        pos++;
        while (pos < src.length() && src.charAt(pos) != close && src.charAt(pos) != '\n') {
            pos++;
        }
        if (pos >= src.length() || src.charAt(pos) != close) {
            throw lexError(unterminated, "unterminated " + what + " starting at column " + (start - lineStart + 1));
        }
        String content = src.substring(start + 1, pos);
        pos++;
        add(kind, kind == TokenKind.BRACKET_IDENTIFIER ? content.trim() : content, start);
    }

    private void scanWord() {
        int start = pos;
        while (pos < src.length()) {
            int cp = src.codePointAt(pos);
            if (!isWordChar(cp)) {
                break;
            }
            pos += Character.charCount(cp);
        }
        String word = src.substring(start, pos);
        if (KEYWORDS.contains(word)) {
            add(TokenKind.KEYWORD, word, start);
        } else if (isNumber(word)) {
            add(TokenKind.NUMBER, word, start);
        } else {
            add(TokenKind.IDENTIFIER, word, start);
        }
    }

    private void add(TokenKind kind, String lexeme, int offset) {
        tokens.add(new Token(kind, lexeme, line, offset - lineStart + 1));
    }

    private LexException lexError(ErrorCode code, String message) {
        return new LexException(code, message, line, lines.get(line - 1));
    }

    private static boolean isWordChar(int cp) {
        return Character.isLetterOrDigit(cp) || cp == '_' || cp == '-' || cp == '.';
    }

    private static boolean isNumber(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (!Character.isDigit(word.charAt(i))) {
                return false;
            }
        }
        return !word.isEmpty();
    }
}
