package com.acme.identity.capl.normalize;

import com.acme.identity.capl.ast.Action;
import com.acme.identity.capl.ast.GrantControl;
import com.acme.identity.capl.ast.Operand;
import com.acme.identity.capl.ast.SessionKind;
import com.acme.identity.capl.diag.ErrorCode;
import com.acme.identity.capl.diag.SemanticException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Checks how a leaf's actions combine and folds them into an {@link ActionSet}.
 *
 * <p>BLOCK stands alone. ALLOW never meets REQUIRE. Repeated REQUIREs are AND-joined, so an OR alternate
 * is only accepted on a sole REQUIRE. Each session control appears at most once.</p>
 */
public final class ActionNormalizer {
    static final String AND = "AND";
    static final String OR = "OR";

    private final IntFunction<String> sourceLine;

    public ActionNormalizer(IntFunction<String> sourceLine) {
        this.sourceLine = sourceLine;
    }

    public ActionSet normalize(List<Action> actions) throws SemanticException {
        Action.Block block = null;
        Action.Allow allow = null;
        List<Action.Grant> grants = new ArrayList<>();
        Map<SessionKind, Action.Session> sessions = new EnumMap<>(SessionKind.class);

        for (Action action : actions) {
            if (action instanceof Action.Block b) {
                if (block != null) {
                    throw semantic(ErrorCode.CONFLICTING_ACTIONS, "BLOCK repeated; first on line " + block.line(), b);
                }
                block = b;
            } else if (action instanceof Action.Allow a) {
                if (allow != null) {
                    throw semantic(ErrorCode.CONFLICTING_ACTIONS, "ALLOW repeated; first on line " + allow.line(), a);
                }
                allow = a;
            } else if (action instanceof Action.Grant g) {
                grants.add(g);
            } else if (action instanceof Action.Session s) {
                Action.Session previous = sessions.putIfAbsent(s.kind(), s);
                if (previous != null) {
                    throw semantic(ErrorCode.DUPLICATE_SESSION_CONTROL, "SESSION " + s.kind().keyword()
                        + " already set on line " + previous.line(), s);
                }
            }
        }

        if (block != null && actions.size() > 1) {
            Action other = actions.get(0) == block ? actions.get(1) : actions.get(0);
            throw semantic(ErrorCode.CONFLICTING_ACTIONS, "BLOCK cannot be combined with other actions", other);
        }
        if (block != null) {
            return new ActionSet(OR, List.of(GrantControl.BLOCK_CONTROL), List.of(), Map.of());
        }
        if (allow != null && !grants.isEmpty()) {
            throw semantic(ErrorCode.CONFLICTING_ACTIONS, "ALLOW cannot be combined with REQUIRE", grants.get(0));
        }
        for (Action.Grant g : grants) {
            if (g.hasAlternate() && grants.size() > 1) {
                throw semantic(ErrorCode.MALFORMED_GRANT_COMBINATION,
                    "REQUIRE with OR must be the only REQUIRE of its branch", g);
            }
        }
        if (grants.isEmpty()) {
            return new ActionSet(null, List.of(), List.of(), sessions);
        }

        Set<String> builtIn = new LinkedHashSet<>();
        Set<String> termsOfUse = new LinkedHashSet<>();
        boolean either = false;
        for (Action.Grant g : grants) {
            addControl(g.control(), builtIn, termsOfUse);
            if (g.hasAlternate()) {
                addControl(g.alternate(), builtIn, termsOfUse);
                either = true;
            }
        }
        return new ActionSet(either ? OR : AND, List.copyOf(builtIn), List.copyOf(termsOfUse), sessions);
    }

    private static void addControl(Operand control, Set<String> builtIn, Set<String> termsOfUse) {
        if (control instanceof Operand.Entity entity) {
            termsOfUse.add(entity.identifier());
        } else if (control instanceof Operand.Literal literal) {
            builtIn.add(GrantControl.fromKeyword(literal.keyword())
                .orElseThrow(() -> new IllegalStateException("unknown grant control " + literal.keyword()))
                .wireValue());
        } else {
            throw new IllegalStateException("unresolved grant control: " + control.label());
        }
    }

    private SemanticException semantic(ErrorCode code, String message, Action at) {
        return new SemanticException(code, message, at.line(), sourceLine.apply(at.line()));
    }
}
