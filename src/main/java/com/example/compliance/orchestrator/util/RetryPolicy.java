package com.example.compliance.orchestrator.util;

import com.example.compliance.orchestrator.config.OrchestratorProperties;
import com.example.compliance.orchestrator.exception.DispatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff shared by the dispatcher and the reconciliation sweep. Only wrap
 * work that is safe to repeat: reads, upserts, recomputation, or a call the remote side has not
 * acknowledged yet.
 */
@Slf4j
@Component
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    @Autowired
    public RetryPolicy(OrchestratorProperties properties) {
        this(properties.getRetry().getMaxAttempts(),
                properties.getRetry().getInitialBackoff(),
                properties.getRetry().getMaxBackoff());
    }

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoff = initialBackoff == null ? Duration.ofMillis(500) : initialBackoff;
        this.maxBackoff = maxBackoff == null ? Duration.ofSeconds(5) : maxBackoff;
    }

    public <T> T execute(String action, Supplier<T> work) {
        return execute(action, work, RetryPolicy::isTransient);
    }

    /**
     * Runs {@code work}, retrying failures accepted by {@code retryable} until the attempt budget is
     * spent. The last failure is rethrown unchanged.
     */
    public <T> T execute(String action, Supplier<T> work, Predicate<Throwable> retryable) {
        if (maxAttempts == 1) {
            return work.get();
        }
        return Mono.fromSupplier(work)
                .retryWhen(Retry.backoff(maxAttempts - 1L, initialBackoff)
                        .maxBackoff(maxBackoff)
                        .filter(retryable)
                        .doBeforeRetry(signal -> log.warn("[retry] {} failed (attempt {}/{}): {}",
                                action, signal.totalRetries() + 1, maxAttempts, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((backoff, signal) -> signal.failure()))
                .block();
    }

    public void run(String action, Runnable work) {
        execute(action, () -> {
            work.run();
            return Boolean.TRUE;
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static boolean isTransient(Throwable error) {
        if (error instanceof DispatchException dispatchError) {
            return dispatchError.isTransientFailure();
        }
        return error instanceof TransientDataAccessException
                || error instanceof RecoverableDataAccessException;
    }
}
