package com.acme.identity.capl.ast;

import java.util.List;

/**
 * Parsed compile unit. Top-level trees are independent and do not share conditions.
 */
public record Program(List<VarDecl> variables, List<IfStatement> trees) {
    public Program {
        variables = List.copyOf(variables);
        trees = List.copyOf(trees);
    }
}
