package com.example.authservice.crypto;

import lombok.RequiredArgsConstructor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs {@link CredentialHasher} on a dedicated executor so that BCrypt work
 * does not occupy request-handling threads.
 *
 * Input errors complete the returned future exceptionally instead of throwing.
 * Cancelling a future only abandons the result; the BCrypt round in progress runs to completion.
 */
@RequiredArgsConstructor
public class AsyncCredentialHasher {

    private final CredentialHasher credentialHasher;
    private final Executor hashingExecutor;

    public CompletableFuture<String> hashAsync(String secret) {
        return CompletableFuture.supplyAsync(() -> credentialHasher.hash(secret), hashingExecutor);
    }

    public CompletableFuture<Boolean> compareAsync(String secret, String hashedSecret) {
        return CompletableFuture.supplyAsync(
                () -> credentialHasher.compare(secret, hashedSecret), hashingExecutor);
    }
}
