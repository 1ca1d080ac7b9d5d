package com.acme.identity.capl.compiler;

import com.acme.identity.capl.util.CompilerDefaults;
import com.acme.identity.capl.util.CompilerEnvKeys;
import com.acme.identity.capl.util.EnvVars;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable runtime configuration, read from environment variables.
 */
public record CompilerConfig(
    String namePrefix,
    int nameMaxLength,
    int workers,
    OutputFormat outputFormat,
    Path inputDir,
    Path outputDir,
    int httpPort,
    int maxSourceBytes
) {
    public CompilerConfig {
        Objects.requireNonNull(namePrefix, "namePrefix");
        Objects.requireNonNull(outputFormat, "outputFormat");
        Objects.requireNonNull(inputDir, "inputDir");
        Objects.requireNonNull(outputDir, "outputDir");
    }

    public static CompilerConfig defaults() {
        return fromEnv(Map.of());
    }

    public static CompilerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    public static CompilerConfig fromEnv(Map<String, String> env) {
        return new CompilerConfig(
            EnvVars.getOrDefault(env, CompilerEnvKeys.CAPL_NAME_PREFIX, CompilerDefaults.NAME_PREFIX),
            EnvVars.getIntClamped(env, CompilerEnvKeys.CAPL_NAME_MAX_LENGTH, CompilerDefaults.NAME_MAX_LENGTH,
                CompilerDefaults.NAME_MAX_LENGTH_MIN, CompilerDefaults.NAME_MAX_LENGTH_MAX),
            EnvVars.getIntClamped(env, CompilerEnvKeys.CAPL_COMPILER_WORKERS, CompilerDefaults.WORKERS,
                CompilerDefaults.WORKERS_MIN, CompilerDefaults.WORKERS_MAX),
            EnvVars.getEnum(env, CompilerEnvKeys.CAPL_OUTPUT_FORMAT, OutputFormat.class, OutputFormat.JSON),
            Path.of(EnvVars.getOrDefault(env, CompilerEnvKeys.CAPL_INPUT_DIR, CompilerDefaults.INPUT_DIR)),
            Path.of(EnvVars.getOrDefault(env, CompilerEnvKeys.CAPL_OUTPUT_DIR, CompilerDefaults.OUTPUT_DIR)),
            EnvVars.getIntClamped(env, CompilerEnvKeys.CAPL_HTTP_PORT, CompilerDefaults.HTTP_PORT, 0, 65_535),
            EnvVars.getIntClamped(env, CompilerEnvKeys.CAPL_HTTP_MAX_SOURCE_BYTES, CompilerDefaults.MAX_SOURCE_BYTES,
                CompilerDefaults.MAX_SOURCE_BYTES_MIN, CompilerDefaults.MAX_SOURCE_BYTES_MAX)
        );
    }

    public CompilerConfig withOutputFormat(OutputFormat format) {
        return new CompilerConfig(namePrefix, nameMaxLength, workers, format, inputDir, outputDir, httpPort, maxSourceBytes);
    }

    public CompilerConfig withPaths(Path input, Path output) {
        return new CompilerConfig(namePrefix, nameMaxLength, workers, outputFormat, input, output, httpPort, maxSourceBytes);
    }
}
