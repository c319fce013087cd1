package com.example.schoolidentity.security;

import com.example.schoolidentity.entity.AccountRecord;
import com.example.schoolidentity.entity.PrincipalKind;
import com.example.schoolidentity.entity.Role;

import java.util.Set;

/**
 * Role tag inference for accounts stored before an explicit role was mandatory.
 *
 * Order: explicit role, originating store, learner marker, guardian marker, then "user".
 * Only the role backfill and credential issuance for untagged rows use this.
 * Marker checks are heuristic: any shape that happens to carry a roll number is tagged
 * as a learner.
 */
public final class RoleInference {

    public static final String LEGACY_USER_TAG = "user";

    static final String LEARNER_MARKER = "rollNumber";
    static final String GUARDIAN_MARKER = "parentType";

    private RoleInference() {
    }

    public static String inferTag(AccountRecord account) {
        return inferTag(account.getRole(), account.getKind(), account.getMarkerAttributes());
    }

    public static String inferTag(Role explicitRole, PrincipalKind sourceStore, Set<String> markers) {
        if (explicitRole != null) {
            return explicitRole.tag();
        }
        if (sourceStore == PrincipalKind.STUDENT) {
            return Role.STUDENT.tag();
        }
        if (sourceStore == PrincipalKind.GUARDIAN) {
            return Role.PARENT.tag();
        }
        if (markers != null && markers.contains(LEARNER_MARKER)) {
            return Role.STUDENT.tag();
        }
        if (markers != null && markers.contains(GUARDIAN_MARKER)) {
            return Role.PARENT.tag();
        }
        return LEGACY_USER_TAG;
    }
}
