package com.example.authservice.dto;

import com.example.authservice.user.UserAccount;

import java.time.Instant;

/**
 * User profile safe to return to clients (no password hash).
 */
public record UserProfile(
    long id,
    String email,
    String name,
    String role,
    Instant createdAt
) {
    public static UserProfile from(UserAccount account) {
        return new UserProfile(
                account.id(),
                account.email(),
                account.name(),
                account.role(),
                account.createdAt());
    }
}
