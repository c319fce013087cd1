package com.example.schoolidentity.security;

import java.time.Instant;

/**
 * Decoded payload of a verified credential.
 *
 * @param principalId id inside the store selected by the role tag
 * @param roleTag     role tag as issued; null for credentials issued before role tagging
 * @param tenantId    school id; null for global admins and some guardians
 */
public record CredentialClaims(
        String principalId,
        String roleTag,
        String tenantId,
        String email,
        Instant issuedAt,
        Instant expiresAt) {

    public boolean hasRoleTag() {
        return roleTag != null && !roleTag.isBlank();
    }
}
