package com.example.schoolidentity.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for operations the caller may not perform (HTTP 403), outside the per-route role check.
 */
public class ForbiddenException extends BaseException {

    public ForbiddenException(String message) {
        super("FORBIDDEN", message, HttpStatus.FORBIDDEN);
    }

    public static ForbiddenException invalidRegistrationSecret() {
        return new ForbiddenException("Invalid secret code. Only authorized personnel can register as admin.");
    }
}
