package com.acme.identity.capl.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One condition line. Several values are OR-joined alternatives within the same category,
 * operator and member kind.
 */
public record Condition(
    Category category,
    boolean negated,
    MatchOperator operator,
    MemberKind member,
    List<Operand> values,
    int line
) {
    public Condition {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(member, "member");
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("condition requires at least one value");
        }
    }

    public Condition withValues(List<Operand> newValues) {
        return new Condition(category, negated, operator, member, newValues, line);
    }

    /**
     * Negation as a conjunction: NOT (a OR b) is (NOT a) AND (NOT b), one single-value condition per value.
     */
    public List<Condition> negations() {
        List<Condition> out = new ArrayList<>(values.size());
        for (Operand value : values) {
            out.add(new Condition(category, !negated, operator, member, List.of(value), line));
        }
        return out;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder(category.keyword());
        if (negated) {
            sb.append(" NOT");
        }
        sb.append(' ').append(operator.keyword());
        if (member != MemberKind.NONE) {
            sb.append(' ').append(member.name().toLowerCase(java.util.Locale.ROOT));
        }
        for (int i = 0; i < values.size(); i++) {
            sb.append(i == 0 ? " " : " OR ").append(values.get(i).label());
        }
        return sb.toString();
    }
}
