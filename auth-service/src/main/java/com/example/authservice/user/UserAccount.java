package com.example.authservice.user;

import java.time.Instant;

/**
 * User record as supplied by the user store.
 */
public record UserAccount(
    long id,
    String email,
    String name,
    String role,
    String passwordHash,
    Instant createdAt
) {
}
