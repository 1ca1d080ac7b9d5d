package com.acme.identity.capl.emit;

import com.acme.identity.capl.ast.BranchState;
import com.acme.identity.capl.paths.PolicyPath;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyNamerTest {

    @Test
    void shouldJoinPrefixIndexAndTrail() {
        PolicyNamer namer = new PolicyNamer("Generated", 256);
        assertEquals("Generated-2-GlobalAdministrator-NotTrusted",
            namer.name(path(2, "Global Administrator", "NotTrusted")));
    }

    @Test
    void shouldSanitizePrefixAndFallBackWhenEmpty() {
        assertEquals("Contoso-Prod-v1", new PolicyNamer(" Contoso_Prod.v1! ", 256).prefix());
        assertEquals("Policy", new PolicyNamer("***", 256).prefix());
    }

    @Test
    void shouldTruncateTrailButKeepIndex() {
        PolicyNamer namer = new PolicyNamer("Generated", 20);
        String name = namer.name(path(12, "Administrators", "Trusted"));
        assertEquals(20, name.length());
        assertTrue(name.startsWith("Generated-12-"));

        assertEquals("Gener-12345", new PolicyNamer("Generated", 11).name(path(12345, "Admins")));
    }

    @Test
    void shouldDropTrailingDashAfterCut() {
        PolicyNamer namer = new PolicyNamer("P", 8);
        assertEquals("P-1-Abcd", namer.name(path(1, "Abcd", "Efgh")));
        assertEquals("P-1-Ab", new PolicyNamer("P", 7).name(path(1, "Ab", "Cd")));
    }

    private static PolicyPath path(int index, String... trail) {
        return new PolicyPath(index, 0, List.of(), BranchState.ENABLED, List.of(), List.of(trail), 1);
    }
}
