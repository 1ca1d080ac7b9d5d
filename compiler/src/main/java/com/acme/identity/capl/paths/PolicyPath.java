package com.acme.identity.capl.paths;

import com.acme.identity.capl.ast.Action;
import com.acme.identity.capl.ast.BranchState;
import com.acme.identity.capl.ast.Condition;

import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one root-to-leaf walk: the AND-joined condition stack, the leaf's state and actions.
 *
 * @param index     1-based leaf ordinal across the compile unit, in traversal order
 * @param treeIndex 0-based position of the owning top-level tree
 * @param trail     one naming token per branch level, root first
 * @param line      source line of the leaf branch
 */
public record PolicyPath(
    int index,
    int treeIndex,
    List<Condition> conditions,
    BranchState state,
    List<Action> actions,
    List<String> trail,
    int line
) {
    public PolicyPath {
        Objects.requireNonNull(state, "state");
        conditions = List.copyOf(conditions);
        actions = List.copyOf(actions);
        trail = List.copyOf(trail);
    }
}
