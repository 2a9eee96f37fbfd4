package com.example.authservice.token;

/**
 * Identity a token is issued for.
 */
public record UserIdentity(
    long id,
    String email,
    String role
) {
}
