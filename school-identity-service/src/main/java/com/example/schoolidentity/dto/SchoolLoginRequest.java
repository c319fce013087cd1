package com.example.schoolidentity.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * Learner or guardian login request.
 * schoolId is only needed when the email is registered in more than one school.
 */
public record SchoolLoginRequest(
    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    String email,

    @NotBlank(message = "Password is required")
    String password,

    String schoolId
) {
}
