package com.acme.identity.capl.lexer;

import com.acme.identity.capl.diag.Diagnostic;
import com.acme.identity.capl.diag.DiagnosticKind;
import com.acme.identity.capl.diag.ErrorCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LexerTest {

    @Test
    void shouldTokenizeVariableDeclaration() {
        LexResult result = Lexer.tokenize("VAR Admins = \"Global Admin\" [ 62e90394-69f5 ]");

        assertTrue(result.diagnostics().isEmpty());
        assertEquals(List.of(TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.EQUALS, TokenKind.STRING,
            TokenKind.BRACKET_IDENTIFIER, TokenKind.EOF), kinds(result));
        assertEquals("Global Admin", result.tokens().get(3).lexeme());
        assertEquals("62e90394-69f5", result.tokens().get(4).lexeme());
    }

    @Test
    void shouldClassifyKeywordsNumbersAndHyphenatedWords() {
        LexResult result = Lexer.tokenize("SESSION signin-frequency 12 hours");

        assertEquals(List.of(TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.NUMBER, TokenKind.IDENTIFIER,
            TokenKind.EOF), kinds(result));
        assertEquals("signin-frequency", result.tokens().get(1).lexeme());
        assertEquals("12", result.tokens().get(2).lexeme());
    }

    @Test
    void shouldKeepCommentsNewlinesAndPositions() {
        LexResult result = Lexer.tokenize("# heading\nIF\n  user is All");

        List<Token> tokens = result.tokens();
        assertEquals(TokenKind.COMMENT, tokens.get(0).kind());
        assertEquals("heading", tokens.get(0).lexeme());
        assertEquals(TokenKind.NEWLINE, tokens.get(1).kind());
        assertTrue(tokens.get(2).isKeyword("IF"));
        Token user = tokens.get(4);
        assertTrue(user.isIdentifier("user"));
        assertEquals(3, user.line());
        assertEquals(3, user.column());
        assertTrue(tokens.get(5).isKeyword("is"));
    }

    @Test
    void shouldTreatKeywordsCaseSensitively() {
        LexResult result = Lexer.tokenize("if IF");

        assertEquals(TokenKind.IDENTIFIER, result.tokens().get(0).kind());
        assertEquals(TokenKind.KEYWORD, result.tokens().get(1).kind());
    }

    @Test
    void shouldReportUnrecognizedCharacterWithIndentedSourceLine() {
        LexResult result = Lexer.tokenize("IF user is All\n    location is @Trusted");

        assertEquals(1, result.diagnostics().size());
        Diagnostic d = result.diagnostics().get(0);
        assertEquals(DiagnosticKind.LEX_ERROR, d.kind());
        assertEquals(ErrorCode.UNRECOGNIZED_CHARACTER, d.code());
        assertEquals(2, d.line());
        assertEquals("    location is @Trusted", d.sourceText());
        assertTrue(kinds(result).contains(TokenKind.ERROR));
        assertTrue(d.format().startsWith("line 2: LEX_ERROR [UNRECOGNIZED_CHARACTER]"));
    }

    @Test
    void shouldReportUnterminatedStringAndBracketPerLine() {
        LexResult result = Lexer.tokenize("VAR A = \"open\nVAR B = \"b\" [id\n");

        assertEquals(2, result.diagnostics().size());
        assertEquals(ErrorCode.UNTERMINATED_STRING, result.diagnostics().get(0).code());
        assertEquals(1, result.diagnostics().get(0).line());
        assertEquals(ErrorCode.UNTERMINATED_BRACKET, result.diagnostics().get(1).code());
        assertEquals(2, result.diagnostics().get(1).line());
    }

    @Test
    void shouldReportSupplementaryCharacterOnce() {
        LexResult result = Lexer.tokenize("IF user is \uD83D\uDE00All\n");

        assertEquals(1, result.diagnostics().size());
        Diagnostic d = result.diagnostics().get(0);
        assertEquals(ErrorCode.UNRECOGNIZED_CHARACTER, d.code());
        assertEquals("unrecognized character '\uD83D\uDE00'", d.message());
        Token error = result.tokens().get(3);
        assertEquals(TokenKind.ERROR, error.kind());
        assertEquals("\uD83D\uDE00", error.lexeme());
        assertEquals("All", result.tokens().get(4).lexeme());
    }

    @Test
    void shouldAcceptSupplementaryLettersInWords() {
        LexResult result = Lexer.tokenize("VAR Team\uD835\uDC00 = \"Math\" [m-1]");

        assertTrue(result.diagnostics().isEmpty());
        assertEquals("Team\uD835\uDC00", result.tokens().get(1).lexeme());
        assertEquals(TokenKind.IDENTIFIER, result.tokens().get(1).kind());
    }

    @Test
    void shouldEndWithEofOnEmptyInput() {
        LexResult result = Lexer.tokenize("");

        assertEquals(List.of(TokenKind.EOF), kinds(result));
        assertEquals("", result.sourceLine(5));
    }

    private static List<TokenKind> kinds(LexResult result) {
        List<TokenKind> out = new ArrayList<>();
        for (Token t : result.tokens()) {
            out.add(t.kind());
        }
        return out;
    }
}
