package com.acme.identity.capl.ast;

import java.util.List;
import java.util.Objects;

/**
 * Enforcement outcome attached to a leaf branch.
 */
public sealed interface Action permits Action.Grant, Action.Block, Action.Allow, Action.Session {

    int line();

    /**
     * {@code REQUIRE control [OR alternate]}. A present alternate means either control satisfies the grant.
     */
    record Grant(Operand control, Operand alternate, int line) implements Action {
        public Grant {
            Objects.requireNonNull(control, "control");
        }

        public boolean hasAlternate() {
            return alternate != null;
        }
    }

    record Block(int line) implements Action {}

    record Allow(int line) implements Action {}

    /**
     * {@code SESSION kind params...}; parameters are validated by the parser per kind.
     */
    record Session(SessionKind kind, List<String> parameters, int line) implements Action {
        public Session {
            Objects.requireNonNull(kind, "kind");
            parameters = List.copyOf(parameters);
        }
    }
}
