package com.acme.identity.capl.paths;

import com.acme.identity.capl.ast.Branch;
import com.acme.identity.capl.ast.BranchBody;
import com.acme.identity.capl.ast.Condition;
import com.acme.identity.capl.ast.IfStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first flattening of decision trees into {@link PolicyPath}s.
 *
 * <p>An IF pushes its own conditions. An ELSE IF pushes the negation of every earlier sibling's
 * conditions and then its own, so sibling leaves never overlap. An ELSE pushes the negations only.
 * Negating a condition yields one negated single-value condition per OR-joined value, all AND-joined.</p>
 *
 * <p>Leaf indexes continue across calls, so one instance numbers a whole compile unit.</p>
 */
public final class PathEnumerator {
    static final String OTHERWISE = "Otherwise";
    static final String NOT_PREFIX = "Not";

    private int nextIndex = 1;

    public List<PolicyPath> enumerate(int treeIndex, IfStatement tree) {
        List<PolicyPath> out = new ArrayList<>();
        walk(treeIndex, tree, new ArrayList<>(), new ArrayList<>(), out);
        return out;
    }

    private void walk(int treeIndex, IfStatement stmt, List<Condition> stack, List<String> trail, List<PolicyPath> out) {
        List<Condition> taken = new ArrayList<>();
        for (Branch branch : stmt.conditionalBranches()) {
            int mark = stack.size();
            pushNegations(stack, taken);
            stack.addAll(branch.conditions());
            trail.add(token(branch.conditions().get(0)));
            descend(treeIndex, branch, stack, trail, out);
            trail.remove(trail.size() - 1);
            truncate(stack, mark);
            taken.addAll(branch.conditions());
        }
        if (stmt.hasElse()) {
            int mark = stack.size();
            pushNegations(stack, taken);
            trail.add(elseToken(stmt));
            descend(treeIndex, stmt.elseBranch(), stack, trail, out);
            trail.remove(trail.size() - 1);
            truncate(stack, mark);
        }
    }

    private void descend(int treeIndex, Branch branch, List<Condition> stack, List<String> trail, List<PolicyPath> out) {
        if (branch.body() instanceof BranchBody.NestedIf nested) {
            walk(treeIndex, nested.statement(), stack, trail, out);
            return;
        }
        BranchBody.ActionList leaf = (BranchBody.ActionList) branch.body();
        out.add(new PolicyPath(nextIndex++, treeIndex, stack, branch.state(), leaf.actions(), trail, branch.line()));
    }

    private static void pushNegations(List<Condition> stack, List<Condition> taken) {
        for (Condition c : taken) {
            stack.addAll(c.negations());
        }
    }

    private static void truncate(List<Condition> stack, int size) {
        while (stack.size() > size) {
            stack.remove(stack.size() - 1);
        }
    }

    static String token(Condition condition) {
        String label = condition.values().get(0).label();
        return condition.negated() ? NOT_PREFIX + label : label;
    }

    private static String elseToken(IfStatement stmt) {
        if (!stmt.elseIfBranches().isEmpty()) {
            return OTHERWISE;
        }
        Condition first = stmt.ifBranch().conditions().get(0);
        String label = first.values().get(0).label();
        return first.negated() ? label : NOT_PREFIX + label;
    }
}
