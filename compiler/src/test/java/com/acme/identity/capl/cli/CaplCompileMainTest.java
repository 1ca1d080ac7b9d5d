package com.acme.identity.capl.cli;

import com.acme.identity.capl.compiler.CompilerConfig;
import com.acme.identity.capl.util.CompilerDefaults;
import com.acme.identity.capl.util.JsonCodec;
import com.acme.identity.capl.util.StatusCodes;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CaplCompileMainTest {
    private static final String GUESTS = """
        IF user is Guest
            STATE enabled
            REQUIRE MFA
        END
        """;
    private static final String BROKEN = """
        IF user is Guest
            REQUIRE MFA
        END
        """;

    @TempDir
    Path tmp;

    @Test
    void shouldCompileDirectoryAndSkipDraftsAndExamples() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Path out = tmp.resolve("out");
        Files.writeString(in.resolve("guests.capl"), GUESTS);
        Files.writeString(in.resolve("_draft.capl"), BROKEN);
        Files.writeString(in.resolve("EXAMPLE-admins.capl"), BROKEN);
        Files.writeString(in.resolve("notes.txt"), BROKEN);

        int code = CaplCompileMain.run(new String[]{in.toString(), out.toString()}, Map.of());

        assertEquals(StatusCodes.EXIT_OK, code);
        assertTrue(Files.exists(out.resolve("Generated-1-Guest.json")));
        JsonNode policy = JsonCodec.readTree(Files.readString(out.resolve("Generated-1-Guest.json")));
        assertEquals("GuestsOrExternalUsers", policy.at("/Conditions/Users/IncludeUsers/0").asText());

        JsonNode report = JsonCodec.readTree(Files.readString(out.resolve(CompilerDefaults.REPORT_FILE)));
        assertEquals(1, report.get("totalFiles").asInt());
        assertEquals(1, report.get("totalPolicies").asInt());
        assertEquals("guests", report.at("/files/0/file").asText());
    }

    @Test
    void shouldExitWithDiagnosticsAndQualifyNamesForSeveralFiles() throws Exception {
        Path in = Files.createDirectories(tmp.resolve("in"));
        Path out = tmp.resolve("out");
        Files.writeString(in.resolve("broken.capl"), BROKEN);
        Files.writeString(in.resolve("guests.capl"), GUESTS);

        int code = CaplCompileMain.run(new String[]{in.toString(), out.toString()}, Map.of());

        assertEquals(StatusCodes.EXIT_DIAGNOSTICS, code);
        assertTrue(Files.exists(out.resolve("Generated-guests-1-Guest.json")));
        JsonNode report = JsonCodec.readTree(Files.readString(out.resolve(CompilerDefaults.REPORT_FILE)));
        assertEquals(2, report.get("totalFiles").asInt());
        assertEquals(1, report.get("totalDiagnostics").asInt());
        assertEquals("broken", report.at("/files/0/file").asText());
        assertEquals("ACTION_BEFORE_STATE", report.at("/files/0/diagnostics/0/code").asText());
        assertEquals("SYNTAX_ERROR", report.at("/files/0/diagnostics/0/kind").asText());
        assertFalse(report.at("/files/0/diagnostics/0").has("format"));
    }

    @Test
    void shouldWriteYamlForSingleFile() throws Exception {
        Path file = tmp.resolve("guests.capl");
        Path out = tmp.resolve("out");
        Files.writeString(file, GUESTS);

        int code = CaplCompileMain.run(new String[]{file.toString(), out.toString(), "--format=yml"}, Map.of());

        assertEquals(StatusCodes.EXIT_OK, code);
        Path yaml = out.resolve("Generated-1-Guest.yaml");
        assertTrue(Files.exists(yaml));
        JsonNode policy = JsonCodec.readYamlTree(Files.readString(yaml));
        assertEquals("Generated-1-Guest", policy.get("DisplayName").asText());
        assertEquals("mfa", policy.at("/GrantControls/BuiltInControls/0").asText());
    }

    @Test
    void shouldHonorPrefixFromEnvironment() throws Exception {
        Path file = tmp.resolve("guests.capl");
        Path out = tmp.resolve("out");
        Files.writeString(file, GUESTS);

        int code = CaplCompileMain.run(new String[]{file.toString(), out.toString()}, Map.of("CAPL_NAME_PREFIX", "Contoso"));

        assertEquals(StatusCodes.EXIT_OK, code);
        assertTrue(Files.exists(out.resolve("Contoso-1-Guest.json")));
    }

    @Test
    void shouldReturnUsageCodeOnBadArgumentsOrMissingInput() {
        assertEquals(StatusCodes.EXIT_USAGE,
            CaplCompileMain.run(new String[]{tmp.resolve("missing").toString(), tmp.toString()}, Map.of()));
        assertEquals(StatusCodes.EXIT_USAGE, CaplCompileMain.run(new String[]{"--verbose"}, Map.of()));
        assertEquals(StatusCodes.EXIT_USAGE, CaplCompileMain.run(new String[]{"a", "b", "c"}, Map.of()));
        assertEquals(StatusCodes.EXIT_USAGE, CaplCompileMain.run(new String[]{"--format", "xml"}, Map.of()));
    }

    @Test
    void shouldRecognizeCompilableFileNames() {
        assertTrue(CaplCompileMain.isCompilable("admins.capl"));
        assertFalse(CaplCompileMain.isCompilable("_admins.capl"));
        assertFalse(CaplCompileMain.isCompilable("EXAMPLE.capl"));
        assertFalse(CaplCompileMain.isCompilable("admins.txt"));
        assertThrows(IllegalArgumentException.class,
            () -> CaplCompileMain.applyArgs(CompilerConfig.defaults(), new String[]{"--format"}));
    }
}
