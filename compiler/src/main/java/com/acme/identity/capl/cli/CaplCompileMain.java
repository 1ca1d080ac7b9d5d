package com.acme.identity.capl.cli;

import com.acme.identity.capl.compiler.BatchCompiler;
import com.acme.identity.capl.compiler.CompilerConfig;
import com.acme.identity.capl.compiler.OutputFormat;
import com.acme.identity.capl.compiler.SourceUnit;
import com.acme.identity.capl.compiler.UnitResult;
import com.acme.identity.capl.diag.Diagnostic;
import com.acme.identity.capl.util.CompilerDefaults;
import com.acme.identity.capl.util.StatusCodes;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * {@code CaplCompileMain [inputFileOrDir] [outputDir] [--format json|yaml]}
 *
 * <p>Exit code 0 when everything compiled cleanly, 1 when any diagnostic was reported, 2 on usage or I/O errors.</p>
 */
public final class CaplCompileMain {
    private static final Logger LOG = Logger.getLogger(CaplCompileMain.class.getName());

    static final String EXAMPLE_MARKER = "EXAMPLE";
    static final String SKIP_MARKER = "_";

    private CaplCompileMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.getenv()));
    }

    static int run(String[] args, Map<String, String> env) {
        CompilerConfig config;
        try {
            config = applyArgs(CompilerConfig.fromEnv(env), args);
        } catch (IllegalArgumentException e) {
            LOG.severe(e.getMessage());
            LOG.severe("usage: CaplCompileMain [inputFileOrDir] [outputDir] [--format json|yaml]");
            return StatusCodes.EXIT_USAGE;
        }

        List<SourceUnit> units;
        try {
            units = loadUnits(config.inputDir());
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Cannot read input " + config.inputDir(), e);
            return StatusCodes.EXIT_USAGE;
        }
        if (units.isEmpty()) {
            LOG.warning(() -> "No " + CompilerDefaults.SOURCE_EXTENSION + " files to compile in " + config.inputDir());
        }

        List<UnitResult> results;
        try (BatchCompiler batch = new BatchCompiler(config)) {
            results = batch.compileAll(units);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.severe("Interrupted while compiling");
            return StatusCodes.EXIT_USAGE;
        }

        PolicyOutputWriter writer = new PolicyOutputWriter(config.outputDir(), config.outputFormat());
        int policyCount;
        Path report;
        try {
            policyCount = writer.writePolicies(results).size();
            report = writer.writeReport(results);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Cannot write output to " + config.outputDir(), e);
            return StatusCodes.EXIT_USAGE;
        }

        int diagnosticCount = 0;
        for (UnitResult r : results) {
            for (Diagnostic d : r.result().diagnostics()) {
                diagnosticCount++;
                LOG.warning(() -> r.unit().name() + ": " + d.format());
            }
        }
        int files = results.size();
        int diagnostics = diagnosticCount;
        LOG.info(() -> "Compiled " + files + " file(s): " + policyCount + " policies, " + diagnostics
            + " diagnostics; report " + report);
        return diagnosticCount == 0 ? StatusCodes.EXIT_OK : StatusCodes.EXIT_DIAGNOSTICS;
    }

    static CompilerConfig applyArgs(CompilerConfig config, String[] args) {
        List<String> positional = new ArrayList<>();
        OutputFormat format = config.outputFormat();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--format")) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--format needs a value");
                }
                format = parseFormat(args[++i]);
            } else if (arg.startsWith("--format=")) {
                format = parseFormat(arg.substring("--format=".length()));
            } else if (arg.startsWith("--")) {
                throw new IllegalArgumentException("unknown option " + arg);
            } else {
                positional.add(arg);
            }
        }
        if (positional.size() > 2) {
            throw new IllegalArgumentException("too many arguments: " + positional);
        }
        Path input = positional.size() > 0 ? Path.of(positional.get(0)) : config.inputDir();
        Path output = positional.size() > 1 ? Path.of(positional.get(1)) : config.outputDir();
        return config.withOutputFormat(format).withPaths(input, output);
    }

    private static OutputFormat parseFormat(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "json" -> OutputFormat.JSON;
            case "yaml", "yml" -> OutputFormat.YAML;
            default -> throw new IllegalArgumentException("unsupported format '" + raw + "'; expected json or yaml");
        };
    }

    static List<SourceUnit> loadUnits(Path input) throws IOException {
        if (Files.isRegularFile(input)) {
            return List.of(readUnit(input));
        }
        if (!Files.isDirectory(input)) {
            throw new IOException("no such file or directory: " + input);
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(input)) {
            files = listing
                .filter(Files::isRegularFile)
                .filter(p -> isCompilable(p.getFileName().toString()))
                .sorted()
                .toList();
        }
        List<SourceUnit> units = new ArrayList<>(files.size());
        for (Path file : files) {
            units.add(readUnit(file));
        }
        return units;
    }

    static boolean isCompilable(String fileName) {
        return fileName.endsWith(CompilerDefaults.SOURCE_EXTENSION)
            && !fileName.startsWith(SKIP_MARKER)
            && !fileName.startsWith(EXAMPLE_MARKER);
    }

    private static SourceUnit readUnit(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        String name = fileName.endsWith(CompilerDefaults.SOURCE_EXTENSION)
            ? fileName.substring(0, fileName.length() - CompilerDefaults.SOURCE_EXTENSION.length())
            : fileName;
        return new SourceUnit(name, Files.readString(file, StandardCharsets.UTF_8));
    }
}
