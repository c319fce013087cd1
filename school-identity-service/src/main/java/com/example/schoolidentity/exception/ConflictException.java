package com.example.schoolidentity.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for duplicate resources such as an already registered email (HTTP 409).
 */
public class ConflictException extends BaseException {

    public ConflictException(String message) {
        super("CONFLICT", message, HttpStatus.CONFLICT);
    }

    public static ConflictException emailTaken(String email) {
        return new ConflictException("An account already exists with email " + email);
    }
}
