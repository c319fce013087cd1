package com.example.schoolidentity.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for bad request errors (HTTP 400).
 */
public class BadRequestException extends BaseException {

    public BadRequestException(String message) {
        super("BAD_REQUEST", message, HttpStatus.BAD_REQUEST);
    }

    protected BadRequestException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }
}
