package com.acme.identity.capl.emit;

import com.acme.identity.capl.ast.Action;
import com.acme.identity.capl.ast.BranchState;
import com.acme.identity.capl.ast.Category;
import com.acme.identity.capl.ast.Condition;
import com.acme.identity.capl.ast.MatchOperator;
import com.acme.identity.capl.ast.MemberKind;
import com.acme.identity.capl.ast.Operand;
import com.acme.identity.capl.ast.SessionKind;
import com.acme.identity.capl.normalize.ActionNormalizer;
import com.acme.identity.capl.normalize.ActionSet;
import com.acme.identity.capl.normalize.ConditionNormalizer;
import com.acme.identity.capl.normalize.NormalizedConditions;
import com.acme.identity.capl.paths.PolicyPath;
import com.acme.identity.capl.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyEmitterTest {
    private final PolicyEmitter emitter = new PolicyEmitter(new PolicyNamer("Generated", 256));

    @Test
    void shouldEmitOnlyPopulatedConditionBlocks() throws Exception {
        List<Condition> conditions = List.of(
            new Condition(Category.USER, false, MatchOperator.IN, MemberKind.GROUP,
                List.of(new Operand.Entity("Finance", "g-1")), 2),
            new Condition(Category.SIGN_IN_RISK, false, MatchOperator.IS, MemberKind.NONE,
                List.of(new Operand.Literal("High"), new Operand.Literal("Medium")), 3)
        );
        List<Action> actions = List.of(new Action.Grant(new Operand.Literal("MFA"), null, 5));
        GeneratedPolicy policy = emit(1, conditions, actions, BranchState.REPORT_ONLY);

        JsonNode json = JsonCodec.readTree(JsonCodec.writeString(policy));
        assertEquals("Generated-1-Finance", json.get("DisplayName").asText());
        assertEquals("report-only", json.get("State").asText());
        assertEquals("g-1", json.at("/Conditions/Users/IncludeGroups/0").asText());
        assertFalse(json.get("Conditions").get("Users").has("IncludeUsers"));
        assertFalse(json.get("Conditions").has("Platforms"));
        assertEquals("high", json.at("/Conditions/SignInRiskLevels/0").asText());
        assertEquals("medium", json.at("/Conditions/SignInRiskLevels/1").asText());
        assertEquals("AND", json.at("/GrantControls/Operator").asText());
        assertFalse(json.get("GrantControls").has("TermsOfUse"));
        assertFalse(json.has("SessionControls"));
    }

    @Test
    void shouldOmitGrantControlsForAllow() throws Exception {
        GeneratedPolicy policy = emit(3, List.of(), List.of(new Action.Allow(4)), BranchState.ENABLED);
        assertNull(policy.grantControls());
        assertNull(policy.sessionControls());

        JsonNode json = JsonCodec.readTree(JsonCodec.writeString(policy));
        assertFalse(json.has("GrantControls"));
        assertTrue(json.get("Conditions").isEmpty());
    }

    @Test
    void shouldMapEverySessionKind() throws Exception {
        List<Action> actions = List.of(
            new Action.Session(SessionKind.SIGN_IN_FREQUENCY, List.of("12", "hours"), 3),
            new Action.Session(SessionKind.PERSISTENT_BROWSER, List.of("never"), 4),
            new Action.Session(SessionKind.CLOUD_APP_SECURITY, List.of("monitorOnly"), 5),
            new Action.Session(SessionKind.APP_ENFORCED_RESTRICTIONS, List.of(), 6)
        );
        SessionControls s = emit(1, List.of(), actions, BranchState.ENABLED).sessionControls();

        assertEquals(new SessionControls.SignInFrequency(12, "hours", true), s.signInFrequency());
        assertEquals("never", s.persistentBrowser().mode());
        assertEquals("monitorOnly", s.cloudAppSecurity().cloudAppSecurityType());
        assertTrue(s.applicationEnforcedRestrictions().enabled());

        JsonNode json = JsonCodec.readTree(JsonCodec.writeString(s));
        assertEquals(12, json.at("/SignInFrequency/Value").asInt());
        assertTrue(json.at("/ApplicationEnforcedRestrictions/IsEnabled").asBoolean());
    }

    private GeneratedPolicy emit(int index, List<Condition> conditions, List<Action> actions, BranchState state)
        throws Exception {
        List<String> trail = conditions.isEmpty() ? List.of() : List.of(conditions.get(0).values().get(0).label());
        PolicyPath path = new PolicyPath(index, 0, conditions, state, actions, trail, 1);
        NormalizedConditions normalized = new ConditionNormalizer(line -> "").normalize(conditions);
        ActionSet set = new ActionNormalizer(line -> "").normalize(actions);
        return emitter.emit(path, normalized, set);
    }
}
