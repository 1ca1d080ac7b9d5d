package com.acme.identity.capl.symbols;

import com.acme.identity.capl.ast.VarDecl;
import com.acme.identity.capl.diag.Diagnostic;
import com.acme.identity.capl.diag.ErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Compile-unit scoped variable bindings, immutable once built.
 *
 * <p>A name declared twice keeps its first declaration. A declaration with a blank identifier is
 * reported and kept out of the table; references to it fail resolution.</p>
 */
public final class SymbolTable {
    private final Map<String, VarDecl> bindings;
    private final Map<String, VarDecl> rejected;
    private final List<Diagnostic> diagnostics;

    private SymbolTable(Map<String, VarDecl> bindings, Map<String, VarDecl> rejected, List<Diagnostic> diagnostics) {
        this.bindings = Collections.unmodifiableMap(bindings);
        this.rejected = Collections.unmodifiableMap(rejected);
        this.diagnostics = List.copyOf(diagnostics);
    }

    public static SymbolTable build(List<VarDecl> declarations, IntFunction<String> sourceLine) {
        Map<String, VarDecl> bindings = new LinkedHashMap<>();
        Map<String, VarDecl> rejected = new LinkedHashMap<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (VarDecl decl : declarations) {
            VarDecl previous = bindings.containsKey(decl.name()) ? bindings.get(decl.name()) : rejected.get(decl.name());
            if (previous != null) {
                diagnostics.add(Diagnostic.of(ErrorCode.DUPLICATE_VARIABLE,
                    "variable '" + decl.name() + "' is already declared on line " + previous.line(),
                    decl.line(), sourceLine.apply(decl.line())));
                continue;
            }
            if (decl.identifier().isBlank()) {
                diagnostics.add(Diagnostic.of(ErrorCode.EMPTY_IDENTIFIER,
                    "variable '" + decl.name() + "' has an empty identifier",
                    decl.line(), sourceLine.apply(decl.line())));
                rejected.put(decl.name(), decl);
                continue;
            }
            bindings.put(decl.name(), decl);
        }
        return new SymbolTable(bindings, rejected, diagnostics);
    }

    public Optional<VarDecl> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    Optional<VarDecl> rejected(String name) {
        return Optional.ofNullable(rejected.get(name));
    }

    public int size() {
        return bindings.size();
    }

    /** Declaration errors found while building. */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }
}
