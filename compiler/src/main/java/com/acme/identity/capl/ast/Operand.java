package com.acme.identity.capl.ast;

import java.util.Objects;

/**
 * A value position in a condition or grant. Parsing yields {@link Reference} and {@link Entity};
 * resolution rewrites every {@link Reference} into an {@link Entity} or a {@link Literal}.
 */
public sealed interface Operand permits Operand.Reference, Operand.Entity, Operand.Literal {

    /** Label used for display names and diagnostics. */
    String label();

    record Reference(String name) implements Operand {
        public Reference {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String label() {
            return name;
        }
    }

    record Entity(String label, String identifier) implements Operand {
        public Entity {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(identifier, "identifier");
        }
    }

    record Literal(String keyword) implements Operand {
        public Literal {
            Objects.requireNonNull(keyword, "keyword");
        }

        @Override
        public String label() {
            return keyword;
        }
    }
}
