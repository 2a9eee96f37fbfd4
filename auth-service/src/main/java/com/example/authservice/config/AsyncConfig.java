package com.example.authservice.config;

import com.example.authservice.crypto.AsyncCredentialHasher;
import com.example.authservice.crypto.CredentialHasher;
import com.example.authservice.web.RequestIdFilter;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated executor for BCrypt work.
 *
 * Hashing cost grows with 2^workFactor and runs off the request threads.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "hashingExecutor")
    public ThreadPoolTaskExecutor hashingExecutor(
            @Value("${auth.hashing.pool-size:4}") int poolSize,
            @Value("${auth.hashing.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("hashing-");
        executor.setTaskDecorator(requestIdPropagation());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean
    public AsyncCredentialHasher asyncCredentialHasher(
            CredentialHasher credentialHasher,
            @Qualifier("hashingExecutor") ThreadPoolTaskExecutor hashingExecutor) {
        return new AsyncCredentialHasher(credentialHasher, hashingExecutor);
    }

    /**
     * Carries the submitting thread's request id into the worker; the worker's own value
     * is restored afterwards.
     */
    public static TaskDecorator requestIdPropagation() {
        return runnable -> {
            String requestId = MDC.get(RequestIdFilter.MDC_KEY);
            return () -> {
                String previous = MDC.get(RequestIdFilter.MDC_KEY);
                putRequestId(requestId);
                try {
                    runnable.run();
                } finally {
                    putRequestId(previous);
                }
            };
        };
    }

    private static void putRequestId(String requestId) {
        if (requestId != null) {
            MDC.put(RequestIdFilter.MDC_KEY, requestId);
        } else {
            MDC.remove(RequestIdFilter.MDC_KEY);
        }
    }
}
