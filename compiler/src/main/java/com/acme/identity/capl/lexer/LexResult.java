package com.acme.identity.capl.lexer;

import com.acme.identity.capl.diag.Diagnostic;

import java.util.List;

/**
 * Token stream plus the lexical diagnostics found while producing it.
 * Source lines are kept so later stages can quote them in diagnostics.
 */
public record LexResult(List<Token> tokens, List<Diagnostic> diagnostics, List<String> sourceLines) {
    public LexResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
        sourceLines = List.copyOf(sourceLines);
    }

    public String sourceLine(int line) {
        if (line < 1 || line > sourceLines.size()) {
            return "";
        }
        return sourceLines.get(line - 1);
    }
}
