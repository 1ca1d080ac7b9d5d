package com.acme.identity.capl.cli;

import com.acme.identity.capl.compiler.OutputFormat;
import com.acme.identity.capl.compiler.UnitResult;
import com.acme.identity.capl.diag.Diagnostic;
import com.acme.identity.capl.emit.GeneratedPolicy;
import com.acme.identity.capl.util.CompilerDefaults;
import com.acme.identity.capl.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes one file per generated policy ({@code <DisplayName>.<ext>}) and the compile report.
 * A file written earlier in the same call is never overwritten.
 */
public final class PolicyOutputWriter {
    private final Path outputDir;
    private final OutputFormat format;

    public PolicyOutputWriter(Path outputDir, OutputFormat format) {
        this.outputDir = outputDir;
        this.format = format;
    }

    public List<Path> writePolicies(List<UnitResult> results) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        Set<Path> seen = new HashSet<>();
        for (UnitResult r : results) {
            for (GeneratedPolicy policy : r.result().policies()) {
                Path file = outputDir.resolve(policy.displayName() + "." + format.extension());
                if (!seen.add(file)) {
                    throw new FileAlreadyExistsException(file.toString(), null,
                        "policy " + policy.displayName() + " from " + r.unit().name() + " written twice");
                }
                Files.writeString(file, format.render(policy), StandardCharsets.UTF_8);
                written.add(file);
            }
        }
        return written;
    }

    public Path writeReport(List<UnitResult> results) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(CompilerDefaults.REPORT_FILE);
        Files.writeString(file, JsonCodec.writePretty(report(results)), StandardCharsets.UTF_8);
        return file;
    }

    static CompileReport report(List<UnitResult> results) {
        List<CompileReport.FileEntry> entries = new ArrayList<>(results.size());
        int policies = 0;
        int diagnostics = 0;
        for (UnitResult r : results) {
            List<String> names = new ArrayList<>();
            for (GeneratedPolicy p : r.result().policies()) {
                names.add(p.displayName());
            }
            List<Diagnostic> diags = r.result().diagnostics();
            entries.add(new CompileReport.FileEntry(r.unit().name(), names.size(), names, diags));
            policies += names.size();
            diagnostics += diags.size();
        }
        return new CompileReport(results.size(), policies, diagnostics, entries);
    }
}
