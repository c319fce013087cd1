package com.example.schoolidentity.entity;

/**
 * Audit action types for AuditLog.
 */
public enum AuditAction {
    // Account lifecycle
    CREATE,            // Account created (admin registration, staff creation)
    GUARDIAN_LINKED,   // Learner linked to guardian
    GUARDIAN_UNLINKED, // Learner unlinked from guardian

    // Authentication
    LOGIN_SUCCESS,
    LOGIN_FAILED,      // Wrong email or password
    LOGIN_DENIED,      // Locked or deactivated account
    ACCOUNT_LOCKED,    // Failed-attempt threshold reached
    PASSWORD_CHANGED,

    // Real-time connections
    SESSION_REVOKED    // Open connection closed by the stale-session sweep
}
