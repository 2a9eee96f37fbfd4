package com.example.authservice.user;

import com.example.authservice.exception.EmailAlreadyExistsException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local user store used when no persistent store is configured.
 * Emails are unique; the email index is claimed atomically so concurrent registrations cannot
 * both succeed.
 */
@Slf4j
public class InMemoryUserAccountStore implements UserAccountStore {

    private final Map<Long, UserAccount> usersById = new ConcurrentHashMap<>();
    private final Map<String, Long> idsByEmail = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryUserAccountStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<UserAccount> findByEmail(String email) {
        Long id = idsByEmail.get(email);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public Optional<UserAccount> findById(long id) {
        return Optional.ofNullable(usersById.get(id));
    }

    @Override
    public List<UserAccount> findAll() {
        return usersById.values().stream()
                .sorted(Comparator.comparingLong(UserAccount::id))
                .toList();
    }

    @Override
    public UserAccount create(String email, String name, String role, String passwordHash) {
        long id = sequence.incrementAndGet();
        if (idsByEmail.putIfAbsent(email, id) != null) {
            throw new EmailAlreadyExistsException();
        }
        UserAccount account = new UserAccount(id, email, name, role, passwordHash, Instant.now(clock));
        usersById.put(id, account);
        log.debug("Created user id={} role={}", id, role);
        return account;
    }

    @Override
    public Optional<UserAccount> updateRole(long id, String role) {
        UserAccount updated = usersById.computeIfPresent(id, (key, account) -> new UserAccount(
                account.id(), account.email(), account.name(), role, account.passwordHash(), account.createdAt()));
        if (updated != null) {
            log.debug("Updated role of user id={} to {}", id, role);
        }
        return Optional.ofNullable(updated);
    }
}
