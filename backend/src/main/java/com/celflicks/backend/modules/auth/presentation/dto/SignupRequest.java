package com.celflicks.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * username/avatarUrl are passed through as account metadata; their rules are applied by provisioning.
 */
public record SignupRequest(
        @NotBlank(message = "email is required") @Email(message = "email must be valid") @Size(max = 320) String email,
        @NotBlank(message = "password is required") @Size(min = 8, max = 72, message = "password must be 8-72 characters") String password,
        String username,
        String avatarUrl
) {
}
