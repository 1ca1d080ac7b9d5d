package com.acme.identity.capl.ast;

import java.util.List;
import java.util.Objects;

/**
 * Payload of a branch: either a flat action list (a leaf) or exactly one nested IF block.
 */
public sealed interface BranchBody permits BranchBody.ActionList, BranchBody.NestedIf {

    record ActionList(List<Action> actions) implements BranchBody {
        public ActionList {
            actions = List.copyOf(actions);
        }
    }

    record NestedIf(IfStatement statement) implements BranchBody {
        public NestedIf {
            Objects.requireNonNull(statement, "statement");
        }
    }
}
