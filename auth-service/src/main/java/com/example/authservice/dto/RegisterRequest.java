package com.example.authservice.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Registration request DTO.
 *
 * Validation Rules:
 * - email: required, basic format check, stored lower-cased
 * - password: required, at least 6 characters
 * - name: required
 * - role: optional, defaults to student; checked against the known roles in the service
 */
public record RegisterRequest(
    @NotBlank(message = "Email, password, and name are required")
    @Email(regexp = "^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$", message = "Invalid email format")
    String email,

    @NotBlank(message = "Email, password, and name are required")
    @Size(min = 6, message = "Password must be at least 6 characters long")
    String password,

    @NotBlank(message = "Email, password, and name are required")
    String name,

    String role
) {
}
