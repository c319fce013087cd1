package com.example.schoolidentity.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Staff creation by an administrator.
 * schoolId is required for global admins and ignored for school admins,
 * who can only create staff in their own school.
 */
public record CreateStaffRequest(
    @NotBlank(message = "Name is required")
    @Size(max = 100, message = "Name must not exceed 100 characters")
    String name,

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    String email,

    @NotBlank(message = "Password is required")
    @Size(min = 6, max = 128, message = "Password must be 6-128 characters")
    String password,

    @NotBlank(message = "Role is required")
    @Pattern(regexp = "^(teacher|librarian|accountant)$", message = "Role must be teacher, librarian or accountant")
    String role,

    String schoolId
) {
}
