package com.acme.identity.capl.cli;

import com.acme.identity.capl.diag.Diagnostic;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Summary written next to the generated policies.
 */
@JsonPropertyOrder({"totalFiles", "totalPolicies", "totalDiagnostics", "files"})
public record CompileReport(int totalFiles, int totalPolicies, int totalDiagnostics, List<FileEntry> files) {
    public CompileReport {
        files = List.copyOf(files);
    }

    @JsonPropertyOrder({"file", "policyCount", "policies", "diagnostics"})
    public record FileEntry(String file, int policyCount, List<String> policies, List<Diagnostic> diagnostics) {
        public FileEntry {
            policies = List.copyOf(policies);
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
