package com.acme.identity.capl.diag;

import com.acme.identity.capl.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiagnosticTest {

    @Test
    void shouldDeriveKindFromCode() {
        Diagnostic d = Diagnostic.of(ErrorCode.CONTRADICTORY_CONDITION, "conflict", 7, "  location NOT is Trusted");
        assertEquals(DiagnosticKind.CONTRADICTION_ERROR, d.kind());
        assertEquals("line 7: CONTRADICTION_ERROR [CONTRADICTORY_CONDITION] conflict\n    |   location NOT is Trusted",
            d.format());
    }

    @Test
    void shouldOmitSourceLineWhenBlank() {
        Diagnostic d = Diagnostic.of(ErrorCode.MISSING_END, "expected END", 12, null);
        assertEquals("", d.sourceText());
        assertEquals("line 12: SYNTAX_ERROR [MISSING_END] expected END", d.format());
    }

    @Test
    void shouldCarryDiagnosticInException() throws Exception {
        SemanticException e = new SemanticException(ErrorCode.UNDECLARED_VARIABLE, "undeclared variable 'X'", 3, "IF user in group X");
        assertEquals(ErrorCode.UNDECLARED_VARIABLE, e.code());
        assertEquals(3, e.line());
        assertEquals("undeclared variable 'X'", e.getMessage());

        JsonNode json = JsonCodec.readTree(JsonCodec.writeString(e.diagnostic()));
        assertEquals("SEMANTIC_ERROR", json.get("kind").asText());
        assertEquals("IF user in group X", json.get("sourceText").asText());
        assertFalse(json.has("format"));
        assertTrue(json.has("line"));
    }

    @Test
    void shouldCarryLexicalDiagnosticInLexException() {
        LexException e = new LexException(ErrorCode.UNTERMINATED_STRING, "unterminated string", 2, "VAR A = \"x");
        assertEquals(DiagnosticKind.LEX_ERROR, e.diagnostic().kind());
        assertEquals(ErrorCode.UNTERMINATED_STRING, e.code());
        assertEquals(2, e.line());
    }
}
