package com.acme.identity.capl.normalize;

import com.acme.identity.capl.ast.Action;
import com.acme.identity.capl.ast.Operand;
import com.acme.identity.capl.ast.SessionKind;
import com.acme.identity.capl.diag.ErrorCode;
import com.acme.identity.capl.diag.SemanticException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionNormalizerTest {
    private final ActionNormalizer normalizer = new ActionNormalizer(line -> "");

    @Test
    void shouldAndJoinRepeatedRequires() throws Exception {
        ActionSet set = normalizer.normalize(List.of(
            grant("MFA", 3),
            grant("CompliantDevice", 4),
            grant("MFA", 5)
        ));

        assertEquals("AND", set.grantOperator());
        assertEquals(List.of("mfa", "compliantDevice"), set.builtInControls());
        assertTrue(set.termsOfUse().isEmpty());
    }

    @Test
    void shouldOrJoinAlternateIncludingTermsOfUse() throws Exception {
        ActionSet set = normalizer.normalize(List.of(
            new Action.Grant(new Operand.Literal("MFA"), new Operand.Entity("Terms", "tou-1"), 3)
        ));

        assertEquals("OR", set.grantOperator());
        assertEquals(List.of("mfa"), set.builtInControls());
        assertEquals(List.of("tou-1"), set.termsOfUse());
    }

    @Test
    void shouldTurnBlockIntoOrBlockGrant() throws Exception {
        ActionSet set = normalizer.normalize(List.of(new Action.Block(4)));
        assertEquals("OR", set.grantOperator());
        assertEquals(List.of("block"), set.builtInControls());
    }

    @Test
    void shouldLeaveAllowWithoutGrant() throws Exception {
        ActionSet set = normalizer.normalize(List.of(
            new Action.Allow(4),
            new Action.Session(SessionKind.PERSISTENT_BROWSER, List.of("never"), 5)
        ));
        assertFalse(set.hasGrant());
        assertNull(set.grantOperator());
        assertEquals(1, set.sessions().size());
    }

    @Test
    void shouldRejectConflictingCombinations() {
        SemanticException blockAndRequire = assertThrows(SemanticException.class,
            () -> normalizer.normalize(List.of(new Action.Block(3), grant("MFA", 4))));
        assertEquals(ErrorCode.CONFLICTING_ACTIONS, blockAndRequire.code());
        assertEquals(4, blockAndRequire.line());

        assertEquals(ErrorCode.CONFLICTING_ACTIONS, assertThrows(SemanticException.class,
            () -> normalizer.normalize(List.of(new Action.Allow(3), grant("MFA", 4)))).code());
        assertEquals(ErrorCode.CONFLICTING_ACTIONS, assertThrows(SemanticException.class,
            () -> normalizer.normalize(List.of(new Action.Block(3), new Action.Block(4)))).code());
    }

    @Test
    void shouldRejectOrGrantNextToAnotherRequire() {
        SemanticException e = assertThrows(SemanticException.class, () -> normalizer.normalize(List.of(
            grant("PasswordChange", 3),
            new Action.Grant(new Operand.Literal("MFA"), new Operand.Literal("CompliantDevice"), 4)
        )));
        assertEquals(ErrorCode.MALFORMED_GRANT_COMBINATION, e.code());
        assertEquals(4, e.line());
    }

    @Test
    void shouldRejectRepeatedSessionKind() {
        SemanticException e = assertThrows(SemanticException.class, () -> normalizer.normalize(List.of(
            new Action.Session(SessionKind.SIGN_IN_FREQUENCY, List.of("1", "days"), 3),
            new Action.Session(SessionKind.SIGN_IN_FREQUENCY, List.of("4", "hours"), 4)
        )));
        assertEquals(ErrorCode.DUPLICATE_SESSION_CONTROL, e.code());
        assertTrue(e.getMessage().contains("line 3"));
    }

    private static Action.Grant grant(String control, int line) {
        return new Action.Grant(new Operand.Literal(control), null, line);
    }
}
