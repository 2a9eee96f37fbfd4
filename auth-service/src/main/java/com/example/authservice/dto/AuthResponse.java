package com.example.authservice.dto;

/**
 * Response of register and login: a bearer token plus the user's profile.
 */
public record AuthResponse(
    boolean ok,
    String message,
    String token,
    UserProfile user
) {
    public static AuthResponse of(String message, String token, UserProfile user) {
        return new AuthResponse(true, message, token, user);
    }
}
