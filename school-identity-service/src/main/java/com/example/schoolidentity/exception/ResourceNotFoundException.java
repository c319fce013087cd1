package com.example.schoolidentity.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for resource not found (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resource, String id) {
        super(resource.toUpperCase() + "_NOT_FOUND", resource + " not found: " + id, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException student(String id) {
        return new ResourceNotFoundException("Student", id);
    }

    public static ResourceNotFoundException guardian(String id) {
        return new ResourceNotFoundException("Guardian", id);
    }
}
