package com.example.schoolidentity.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for a credential or principal that cannot be authenticated (HTTP 401).
 *
 * The message is deliberately generic so responses do not reveal whether an
 * account exists, is locked or is deactivated. Use {@link #getReason()} for logs.
 */
public class AuthenticationFailedException extends BaseException {

    public static final String GENERIC_MESSAGE = "Authentication required";

    private final AuthFailureReason reason;

    public AuthenticationFailedException(AuthFailureReason reason) {
        super("UNAUTHORIZED", GENERIC_MESSAGE, HttpStatus.UNAUTHORIZED);
        this.reason = reason;
    }

    public AuthenticationFailedException(AuthFailureReason reason, Throwable cause) {
        this(reason);
        initCause(cause);
    }

    public AuthFailureReason getReason() {
        return reason;
    }
}
