package com.acme.identity.capl.normalize;

import com.acme.identity.capl.ast.Action;
import com.acme.identity.capl.ast.SessionKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Validated actions of one leaf.
 *
 * @param grantOperator {@code AND} or {@code OR}; null when the leaf has no grant controls
 */
public record ActionSet(
    String grantOperator,
    List<String> builtInControls,
    List<String> termsOfUse,
    Map<SessionKind, Action.Session> sessions
) {
    public ActionSet {
        builtInControls = List.copyOf(builtInControls);
        termsOfUse = List.copyOf(termsOfUse);
        sessions = sessions.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(sessions));
    }

    public boolean hasGrant() {
        return grantOperator != null;
    }
}
