package com.storefront.backend.modules.auth.presentation.dto;

import com.storefront.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank(message = "username is required")
        @Size(max = 50, message = "username must be at most 50 characters")
        String username,

        @NotBlank(message = "email is required")
        @Email(message = "email must be a valid address")
        @Size(max = 120, message = "email must be at most 120 characters")
        String email,

        @NotBlank(message = "password is required")
        @Size(min = 8, max = 128, message = "password must be 8 to 128 characters")
        String password,

        UserRole role
) {
}
