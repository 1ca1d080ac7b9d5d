package com.acme.identity.capl.diag;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * A single compiler finding, tied to a 1-based source line, or line 0 for findings about a whole
 * unit.
 *
 * <p>{@code sourceText} is the offending line verbatim, indentation included, or empty when the
 * finding has no single source line (end of input).</p>
 */
public record Diagnostic(
    DiagnosticKind kind,
    ErrorCode code,
    String message,
    int line,
    String sourceText
) {
    public Diagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        sourceText = sourceText == null ? "" : sourceText;
    }

    public static Diagnostic of(ErrorCode code, String message, int line, String sourceText) {
        return new Diagnostic(code.kind(), code, message, line, sourceText);
    }

    @JsonIgnore
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("line ").append(line).append(": ")
            .append(kind).append(" [").append(code).append("] ")
            .append(message);
        if (!sourceText.isBlank()) {
            sb.append('\n').append("    | ").append(sourceText);
        }
        return sb.toString();
    }
}
