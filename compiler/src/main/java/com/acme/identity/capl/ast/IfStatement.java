package com.acme.identity.capl.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * IF block with its ELSE IF siblings and optional terminal ELSE, closed by END.
 */
public record IfStatement(Branch ifBranch, List<Branch> elseIfBranches, Branch elseBranch, int line) {
    public IfStatement {
        Objects.requireNonNull(ifBranch, "ifBranch");
        elseIfBranches = List.copyOf(elseIfBranches);
    }

    /** IF and ELSE IF arms in source order; the ELSE arm is not included. */
    public List<Branch> conditionalBranches() {
        List<Branch> out = new ArrayList<>(1 + elseIfBranches.size());
        out.add(ifBranch);
        out.addAll(elseIfBranches);
        return out;
    }

    public boolean hasElse() {
        return elseBranch != null;
    }
}
