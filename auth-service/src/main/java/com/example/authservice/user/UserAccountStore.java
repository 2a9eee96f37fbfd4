package com.example.authservice.user;

import java.util.List;
import java.util.Optional;

/**
 * Port to the platform's user store.
 * Used by the auth and user endpoints only; token verification never reads it.
 */
public interface UserAccountStore {

    Optional<UserAccount> findByEmail(String email);

    Optional<UserAccount> findById(long id);

    List<UserAccount> findAll();

    /**
     * Create a user with the next id.
     *
     * @throws com.example.authservice.exception.EmailAlreadyExistsException if the email is taken
     */
    UserAccount create(String email, String name, String role, String passwordHash);

    /**
     * Replace the stored role of a user. Tokens already issued keep the old role.
     *
     * @return the updated account, or empty if no user has this id
     */
    Optional<UserAccount> updateRole(long id, String role);
}
