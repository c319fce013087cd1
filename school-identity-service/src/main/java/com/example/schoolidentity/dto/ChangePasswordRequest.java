package com.example.schoolidentity.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Password change by the signed-in principal. The current password is re-verified.
 */
public record ChangePasswordRequest(
    @NotBlank(message = "Current password is required")
    String currentPassword,

    @NotBlank(message = "New password is required")
    @Size(min = 6, max = 128, message = "Password must be 6-128 characters")
    String newPassword
) {
}
