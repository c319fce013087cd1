package com.example.schoolidentity.exception;

/**
 * Internal cause of a rejected credential or principal.
 * Logged for operators; the caller only ever sees a generic 401.
 */
public enum AuthFailureReason {
    MISSING_CREDENTIAL("No credential provided"),
    MALFORMED_CREDENTIAL("Credential could not be parsed"),
    INVALID_CREDENTIAL("Credential signature is invalid"),
    EXPIRED_CREDENTIAL("Credential has expired"),
    PRINCIPAL_NOT_FOUND("Credential is valid but the account no longer exists"),
    PRINCIPAL_DEACTIVATED("Account is deactivated"),
    PRINCIPAL_LOCKED("Account is locked due to multiple failed login attempts");

    private final String description;

    AuthFailureReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
