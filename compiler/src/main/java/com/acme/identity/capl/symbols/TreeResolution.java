package com.acme.identity.capl.symbols;

import com.acme.identity.capl.ast.IfStatement;
import com.acme.identity.capl.diag.Diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * One top-level tree after resolution. The tree is only usable when {@link #isClean()}.
 */
public record TreeResolution(int treeIndex, IfStatement tree, List<Diagnostic> diagnostics) {
    public TreeResolution {
        Objects.requireNonNull(tree, "tree");
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
