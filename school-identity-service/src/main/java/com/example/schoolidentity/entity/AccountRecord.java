package com.example.schoolidentity.entity;

import java.time.Instant;
import java.util.Set;

/**
 * Common view over the three account stores, used by credential issuance,
 * identity resolution and the lockout tracker.
 */
public interface AccountRecord {

    String getId();

    PrincipalKind getKind();

    /**
     * Explicit role stored on the row. Null only for rows written before role tagging was mandatory.
     */
    Role getRole();

    String getSchoolId();

    String getEmail();

    String getName();

    String getPasswordHash();

    void setPasswordHash(String passwordHash);

    boolean isActive();

    boolean isDeleted();

    LockoutState getLockout();

    void setLastLoginAt(Instant lastLoginAt);

    /**
     * Names of store-specific attributes present on this row ("rollNumber", "parentType").
     * Only consulted by role inference for untagged rows.
     */
    Set<String> getMarkerAttributes();
}
