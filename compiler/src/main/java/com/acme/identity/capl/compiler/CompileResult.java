package com.acme.identity.capl.compiler;

import com.acme.identity.capl.diag.Diagnostic;
import com.acme.identity.capl.emit.GeneratedPolicy;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Output of one compilation. Policies and diagnostics are not exclusive: trees that compiled cleanly
 * are returned even when other trees failed.
 */
@JsonPropertyOrder({"policies", "diagnostics"})
public record CompileResult(List<GeneratedPolicy> policies, List<Diagnostic> diagnostics) {
    public CompileResult {
        policies = List.copyOf(policies);
        diagnostics = List.copyOf(diagnostics);
    }

    @JsonIgnore
    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
