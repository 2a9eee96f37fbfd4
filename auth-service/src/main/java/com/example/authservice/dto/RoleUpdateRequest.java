package com.example.authservice.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of PATCH /api/users/{id}/role. Membership in the known roles is checked in the service.
 */
public record RoleUpdateRequest(
    @NotBlank(message = "Invalid role data")
    String role
) {
}
