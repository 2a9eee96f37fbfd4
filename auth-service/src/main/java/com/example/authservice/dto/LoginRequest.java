package com.example.authservice.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Login request DTO.
 */
public record LoginRequest(
    @NotBlank(message = "Email and password are required")
    String email,

    @NotBlank(message = "Email and password are required")
    String password
) {
}
