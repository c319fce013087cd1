package com.example.schoolidentity.exception;

import org.springframework.http.HttpStatus;

/**
 * Thrown when login email or password is wrong (HTTP 401).
 * Same response whether the email is unknown or the password is wrong.
 */
public class InvalidCredentialsException extends BaseException {

    public InvalidCredentialsException() {
        super("INVALID_CREDENTIALS", "Invalid credentials", HttpStatus.UNAUTHORIZED);
    }
}
