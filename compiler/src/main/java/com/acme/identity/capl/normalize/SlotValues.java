package com.acme.identity.capl.normalize;

import java.util.List;

/**
 * Merged wire values of one slot on one path, in first-seen order.
 */
public record SlotValues(List<String> include, List<String> exclude) {
    public static final SlotValues EMPTY = new SlotValues(List.of(), List.of());

    public SlotValues {
        include = List.copyOf(include);
        exclude = List.copyOf(exclude);
    }

    public boolean isEmpty() {
        return include.isEmpty() && exclude.isEmpty();
    }
}
