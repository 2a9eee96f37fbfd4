package com.example.authservice.service;

import com.example.authservice.config.AuthSettings;
import com.example.authservice.crypto.AsyncCredentialHasher;
import com.example.authservice.dto.AuthResponse;
import com.example.authservice.dto.LoginRequest;
import com.example.authservice.dto.RegisterRequest;
import com.example.authservice.dto.UserProfile;
import com.example.authservice.exception.InvalidCredentialsException;
import com.example.authservice.exception.UserNotFoundException;
import com.example.authservice.exception.ValidationException;
import com.example.authservice.token.TokenIssuer;
import com.example.authservice.token.UserIdentity;
import com.example.authservice.user.Role;
import com.example.authservice.user.UserAccount;
import com.example.authservice.user.UserAccountStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Authentication service: registration, login, profile lookup and role updates.
 *
 * The only place that validates role membership; tokens carry whatever role the
 * store held when they were issued.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserAccountStore userAccountStore;
    private final AsyncCredentialHasher credentialHasher;
    private final TokenIssuer tokenIssuer;
    private final AuthSettings authSettings;

    /**
     * Register a new user and return a token for immediate login.
     *
     * Steps:
     * 1. Resolve role (default student, must be a known role)
     * 2. Hash password with BCrypt on the hashing executor
     * 3. Create user; the store rejects duplicate emails
     * 4. Issue access token
     *
     * @throws ValidationException 400 unknown role
     * @throws com.example.authservice.exception.EmailAlreadyExistsException 409
     */
    public AuthResponse register(RegisterRequest request) {
        String role = resolveRole(request.role());
        String email = normalizeEmail(request.email());

        String passwordHash = await(credentialHasher.hashAsync(request.password()));
        UserAccount account = userAccountStore.create(email, request.name(), role, passwordHash);

        log.info("User registered: userId={} role={}", account.id(), account.role());
        return AuthResponse.of("User registered successfully", issueToken(account), UserProfile.from(account));
    }

    /**
     * Authenticate by email and password.
     *
     * @throws InvalidCredentialsException 401 unknown email or wrong password
     */
    public AuthResponse login(LoginRequest request) {
        UserAccount account = userAccountStore.findByEmail(normalizeEmail(request.email()))
                .orElseThrow(() -> {
                    log.debug("Login failed: unknown email");
                    return new InvalidCredentialsException();
                });

        boolean matches = await(credentialHasher.compareAsync(request.password(), account.passwordHash()));
        if (!matches) {
            log.debug("Login failed: wrong password for userId={}", account.id());
            throw new InvalidCredentialsException();
        }

        log.info("User logged in: userId={}", account.id());
        return AuthResponse.of("Login successful", issueToken(account), UserProfile.from(account));
    }

    /**
     * Current profile from the store, for the Principal's subject id.
     *
     * @throws UserNotFoundException 404 if the user no longer exists
     */
    public UserProfile getProfile(long userId) {
        return userAccountStore.findById(userId)
                .map(UserProfile::from)
                .orElseThrow(UserNotFoundException::new);
    }

    /**
     * Change a user's stored role. Tokens issued before the change keep carrying the old role.
     *
     * @throws ValidationException 400 missing or unknown role
     * @throws UserNotFoundException 404 no user with this id
     */
    public UserProfile updateRole(long userId, String role) {
        if (role == null || !Role.isKnown(role)) {
            throw ValidationException.invalidRoleData();
        }
        UserAccount account = userAccountStore.updateRole(userId, role)
                .orElseThrow(UserNotFoundException::new);
        log.info("User role updated: userId={} role={}", account.id(), account.role());
        return UserProfile.from(account);
    }

    public List<UserProfile> listUsers() {
        return userAccountStore.findAll().stream()
                .map(UserProfile::from)
                .toList();
    }

    private String issueToken(UserAccount account) {
        return tokenIssuer.sign(
                new UserIdentity(account.id(), account.email(), account.role()),
                authSettings.signingKey(),
                authSettings.tokenTtlSeconds());
    }

    private static String resolveRole(String requested) {
        if (requested == null || requested.isEmpty()) {
            return Role.STUDENT.value();
        }
        if (!Role.isKnown(requested)) {
            throw ValidationException.invalidRole();
        }
        return requested;
    }

    private static String normalizeEmail(String email) {
        return email.toLowerCase(Locale.ROOT);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
