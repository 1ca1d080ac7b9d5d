package com.acme.identity.capl.normalize;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public final class NormalizedConditions {
    private final Map<ConditionSlot, SlotValues> slots;

    NormalizedConditions(Map<ConditionSlot, SlotValues> slots) {
        this.slots = Collections.unmodifiableMap(new EnumMap<>(slots));
    }

    public SlotValues slot(ConditionSlot slot) {
        return slots.getOrDefault(slot, SlotValues.EMPTY);
    }

    public Map<ConditionSlot, SlotValues> slots() {
        return slots;
    }

    @Override
    public String toString() {
        return "NormalizedConditions" + slots;
    }
}
