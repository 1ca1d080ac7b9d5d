package com.acme.identity.capl.normalize;

import com.acme.identity.capl.ast.Category;
import com.acme.identity.capl.ast.Condition;
import com.acme.identity.capl.ast.MemberKind;
import com.acme.identity.capl.ast.Operand;
import com.acme.identity.capl.diag.ContradictionException;
import com.acme.identity.capl.diag.ErrorCode;
import com.acme.identity.capl.diag.UnsupportedNegationException;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Groups a path's condition stack by output slot. Affirmed values are included, negated values excluded.
 */
public final class ConditionNormalizer {
    private final IntFunction<String> sourceLine;

    public ConditionNormalizer(IntFunction<String> sourceLine) {
        this.sourceLine = sourceLine;
    }

    public NormalizedConditions normalize(List<Condition> conditions)
        throws ContradictionException, UnsupportedNegationException {
        Map<ConditionSlot, Set<String>> include = new EnumMap<>(ConditionSlot.class);
        Map<ConditionSlot, Map<String, Condition>> exclude = new EnumMap<>(ConditionSlot.class);
        Map<ConditionSlot, Map<String, Condition>> includeOrigin = new EnumMap<>(ConditionSlot.class);

        for (Condition condition : conditions) {
            ConditionSlot slot = slotOf(condition.category(), condition.member());
            if (condition.negated() && !slot.supportsExclude()) {
                throw new UnsupportedNegationException(ErrorCode.NEGATION_NOT_SUPPORTED,
                    "'" + condition.category().keyword() + "' cannot be negated: the output has no exclude list for it"
                        + " (from: " + condition.describe() + ")",
                    condition.line(), sourceLine.apply(condition.line()));
            }
            for (Operand value : condition.values()) {
                String wire = wireValue(condition.category(), value);
                if (condition.negated()) {
                    exclude.computeIfAbsent(slot, s -> new LinkedHashMap<>()).putIfAbsent(wire, condition);
                } else {
                    include.computeIfAbsent(slot, s -> new LinkedHashSet<>()).add(wire);
                    includeOrigin.computeIfAbsent(slot, s -> new LinkedHashMap<>()).putIfAbsent(wire, condition);
                }
            }
        }

        Map<ConditionSlot, SlotValues> slots = new EnumMap<>(ConditionSlot.class);
        for (ConditionSlot slot : ConditionSlot.values()) {
            Set<String> in = include.getOrDefault(slot, Set.of());
            Map<String, Condition> out = exclude.getOrDefault(slot, Map.of());
            for (Map.Entry<String, Condition> e : out.entrySet()) {
                if (in.contains(e.getKey())) {
                    Condition affirmed = includeOrigin.get(slot).get(e.getKey());
                    Condition negated = e.getValue();
                    int line = Math.max(affirmed.line(), negated.line());
                    throw new ContradictionException(ErrorCode.CONTRADICTORY_CONDITION,
                        "'" + e.getKey() + "' is both included (line " + affirmed.line() + ") and excluded (line "
                            + negated.line() + ") on the same path",
                        line, sourceLine.apply(line));
                }
            }
            if (!in.isEmpty() || !out.isEmpty()) {
                slots.put(slot, new SlotValues(List.copyOf(in), List.copyOf(out.keySet())));
            }
        }
        return new NormalizedConditions(slots);
    }

    static ConditionSlot slotOf(Category category, MemberKind member) {
        return switch (category) {
            case USER -> switch (member) {
                case GROUP -> ConditionSlot.USER_GROUPS;
                case ROLE -> ConditionSlot.USER_ROLES;
                case NONE -> ConditionSlot.USERS;
            };
            case APPLICATION -> ConditionSlot.APPLICATIONS;
            case PLATFORM -> ConditionSlot.PLATFORMS;
            case DEVICE -> ConditionSlot.DEVICE_STATES;
            case LOCATION -> ConditionSlot.LOCATIONS;
            case CLIENT -> ConditionSlot.CLIENT_APP_TYPES;
            case SIGN_IN_RISK -> ConditionSlot.SIGN_IN_RISK;
            case USER_RISK -> ConditionSlot.USER_RISK;
        };
    }

    static String wireValue(Category category, Operand value) {
        if (value instanceof Operand.Entity entity) {
            return entity.identifier();
        }
        if (value instanceof Operand.Literal literal) {
            return category.wireLiteral(literal.keyword())
                .orElseThrow(() -> new IllegalStateException("not a " + category.keyword() + " literal: " + literal.keyword()));
        }
        throw new IllegalStateException("unresolved reference: " + value.label());
    }
}
