package com.example.authservice.dto;

public record ProfileResponse(
    boolean ok,
    UserProfile user
) {
    public static ProfileResponse of(UserProfile user) {
        return new ProfileResponse(true, user);
    }
}
