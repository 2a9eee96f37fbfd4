package com.example.authservice.dto;

public record RoleUpdateResponse(
    boolean ok,
    UserProfile data,
    String message
) {
    public static RoleUpdateResponse of(UserProfile data) {
        return new RoleUpdateResponse(true, data, "User role updated successfully");
    }
}
