package com.acme.identity.capl.compiler;

/**
 * Compiles one CAPL compile unit into flat policy records.
 *
 * <p>Implementations are pure: no I/O, no shared mutable state, safe to call from several threads.
 * Errors never escape as exceptions; they are returned as diagnostics next to whatever output survived.</p>
 */
public interface PolicyCompiler {
    /**
     * @param source     CAPL source text
     * @param namePrefix leading token of every generated display name
     */
    CompileResult compile(String source, String namePrefix);
}
