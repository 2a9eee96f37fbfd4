package com.example.authservice.crypto;

import com.example.authservice.exception.InvalidConfigException;
import com.example.authservice.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * One-way hashing of user secrets with BCrypt.
 *
 * - Fresh random salt on every call: hashing the same secret twice gives two different strings
 * - Work factor embedded in the hash ($2a$NN$...), so {@link #compare} works for hashes made
 *   with any factor
 * - Cost grows with 2^workFactor; callers on a non-blocking thread go through
 *   {@link AsyncCredentialHasher}
 */
@Slf4j
public class CredentialHasher {

    public static final int MIN_WORK_FACTOR = 1;
    public static final int MAX_WORK_FACTOR = 31;
    public static final int DEFAULT_WORK_FACTOR = 12;

    // BCrypt rejects log rounds below 4
    private static final int BCRYPT_MIN_LOG_ROUNDS = 4;

    private volatile int workFactor;
    private volatile BCryptPasswordEncoder encoder;

    public CredentialHasher() {
        this(DEFAULT_WORK_FACTOR);
    }

    public CredentialHasher(int workFactor) {
        setWorkFactor(workFactor);
    }

    /**
     * Hash a plain text secret.
     *
     * @param secret plain text secret, must be non-empty
     * @return BCrypt hash with embedded salt and cost
     * @throws InvalidInputException if the secret is null or empty
     */
    public String hash(String secret) {
        requireNonEmpty(secret, "Password must be a non-empty string");
        return encoder.encode(secret);
    }

    /**
     * Verify a plain text secret against a stored hash.
     *
     * @return true iff the secret produced the hash; false for a hash that is not BCrypt
     * @throws InvalidInputException if either argument is null or empty
     */
    public boolean compare(String secret, String hashedSecret) {
        requireNonEmpty(secret, "Password must be a non-empty string");
        requireNonEmpty(hashedSecret, "Hashed password must be a non-empty string");
        return encoder.matches(secret, hashedSecret);
    }

    public int getWorkFactor() {
        return workFactor;
    }

    /**
     * Change the cost used for new hashes. Existing hashes keep verifying.
     *
     * @throws InvalidConfigException if the factor is outside [1, 31]
     */
    public void setWorkFactor(int workFactor) {
        validateWorkFactor(workFactor);
        int logRounds = Math.max(workFactor, BCRYPT_MIN_LOG_ROUNDS);
        if (logRounds != workFactor) {
            log.debug("Work factor {} is below the BCrypt minimum, hashing with cost {}", workFactor, logRounds);
        }
        this.encoder = new BCryptPasswordEncoder(logRounds);
        this.workFactor = workFactor;
    }

    public static void validateWorkFactor(int workFactor) {
        if (workFactor < MIN_WORK_FACTOR || workFactor > MAX_WORK_FACTOR) {
            throw new InvalidConfigException(String.format(
                    "Cost factor must be an integer between %d and %d", MIN_WORK_FACTOR, MAX_WORK_FACTOR));
        }
    }

    private static void requireNonEmpty(String value, String message) {
        if (value == null || value.isEmpty()) {
            throw new InvalidInputException(message);
        }
    }
}
