package com.example.schoolidentity.realtime;

import com.example.schoolidentity.entity.PrincipalKind;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.security.CredentialClaims;
import com.example.schoolidentity.security.ResolvedPrincipal;

/**
 * What a real-time connection knows about its principal, bound at handshake time.
 * The claims are kept so the session sweeper can re-check the principal later.
 */
public record RealtimeIdentity(
        String principalId,
        PrincipalKind kind,
        Role role,
        String tenantId,
        String classId,
        CredentialClaims claims) {

    public static final String SESSION_ATTRIBUTE = "realtime.identity";

    public static RealtimeIdentity of(CredentialClaims claims, ResolvedPrincipal principal) {
        return new RealtimeIdentity(
                principal.id(),
                principal.kind(),
                principal.role(),
                principal.tenantId(),
                principal.classId(),
                claims);
    }
}
