package com.acme.identity.capl.ast;

import java.util.List;
import java.util.Objects;

/**
 * One IF / ELSE IF / ELSE arm. ELSE arms have no explicit conditions.
 */
public record Branch(
    BranchKind kind,
    List<Condition> conditions,
    BranchState state,
    BranchBody body,
    int line
) {
    public Branch {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(body, "body");
        conditions = List.copyOf(conditions);
    }

    public boolean isLeaf() {
        return body instanceof BranchBody.ActionList;
    }

    public Branch withConditionsAndBody(List<Condition> newConditions, BranchBody newBody) {
        return new Branch(kind, newConditions, state, newBody, line);
    }
}
