package com.acme.identity.capl.emit;

import com.acme.identity.capl.ast.Action;
import com.acme.identity.capl.normalize.ActionSet;
import com.acme.identity.capl.normalize.ConditionSlot;
import com.acme.identity.capl.normalize.NormalizedConditions;
import com.acme.identity.capl.normalize.SlotValues;
import com.acme.identity.capl.paths.PolicyPath;

import java.util.List;

/**
 * Maps a normalized path onto the canonical {@link GeneratedPolicy} record.
 */
public final class PolicyEmitter {
    private final PolicyNamer namer;

    public PolicyEmitter(PolicyNamer namer) {
        this.namer = namer;
    }

    public GeneratedPolicy emit(PolicyPath path, NormalizedConditions conditions, ActionSet actions) {
        return new GeneratedPolicy(
            namer.name(path),
            path.state(),
            conditions(conditions),
            grantControls(actions),
            sessionControls(actions)
        );
    }

    static PolicyConditions conditions(NormalizedConditions c) {
        SlotValues users = c.slot(ConditionSlot.USERS);
        SlotValues groups = c.slot(ConditionSlot.USER_GROUPS);
        SlotValues roles = c.slot(ConditionSlot.USER_ROLES);
        PolicyConditions.Users userBlock = users.isEmpty() && groups.isEmpty() && roles.isEmpty()
            ? null
            : new PolicyConditions.Users(users.include(), users.exclude(), groups.include(), groups.exclude(),
                roles.include(), roles.exclude());

        SlotValues apps = c.slot(ConditionSlot.APPLICATIONS);
        SlotValues platforms = c.slot(ConditionSlot.PLATFORMS);
        SlotValues locations = c.slot(ConditionSlot.LOCATIONS);
        SlotValues devices = c.slot(ConditionSlot.DEVICE_STATES);
        return new PolicyConditions(
            userBlock,
            apps.isEmpty() ? null : new PolicyConditions.Applications(apps.include(), apps.exclude()),
            platforms.isEmpty() ? null : new PolicyConditions.Platforms(platforms.include(), platforms.exclude()),
            locations.isEmpty() ? null : new PolicyConditions.Locations(locations.include(), locations.exclude()),
            devices.isEmpty() ? null : new PolicyConditions.DeviceStates(devices.include(), devices.exclude()),
            c.slot(ConditionSlot.CLIENT_APP_TYPES).include(),
            c.slot(ConditionSlot.SIGN_IN_RISK).include(),
            c.slot(ConditionSlot.USER_RISK).include()
        );
    }

    static GrantControls grantControls(ActionSet actions) {
        if (!actions.hasGrant()) {
            return null;
        }
        return new GrantControls(actions.grantOperator(), actions.builtInControls(), actions.termsOfUse());
    }

    static SessionControls sessionControls(ActionSet actions) {
        if (actions.sessions().isEmpty()) {
            return null;
        }
        SessionControls.SignInFrequency frequency = null;
        SessionControls.PersistentBrowser browser = null;
        SessionControls.CloudAppSecurity cloud = null;
        SessionControls.ApplicationEnforcedRestrictions restrictions = null;
        for (Action.Session s : actions.sessions().values()) {
            List<String> p = s.parameters();
            switch (s.kind()) {
                case SIGN_IN_FREQUENCY -> frequency = new SessionControls.SignInFrequency(Integer.parseInt(p.get(0)), p.get(1), true);
                case PERSISTENT_BROWSER -> browser = new SessionControls.PersistentBrowser(p.get(0), true);
                case CLOUD_APP_SECURITY -> cloud = new SessionControls.CloudAppSecurity(p.get(0), true);
                case APP_ENFORCED_RESTRICTIONS -> restrictions = new SessionControls.ApplicationEnforcedRestrictions(true);
            }
        }
        return new SessionControls(frequency, browser, cloud, restrictions);
    }
}
