package com.demo.messaging.client;

import com.demo.messaging.exception.MessagingException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs an async call, retrying transient failures according to a {@link RetryPolicy}.
 *
 * Only retryable failures (network, timeout, unavailable) are retried;
 * validation, authorization and not-found errors fail on the first attempt.
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy policy;

    public RetryExecutor(RetryPolicy policy) {
        this.policy = policy;
    }

    public <T> CompletableFuture<T> execute(String operation, Supplier<CompletableFuture<T>> call) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operation, call, 1, result);
        return result;
    }

    private <T> void attempt(String operation,
                             Supplier<CompletableFuture<T>> call,
                             int attempt,
                             CompletableFuture<T> result) {
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        future.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }

            Throwable cause = unwrap(error);
            if (!isRetryable(cause)) {
                result.completeExceptionally(cause);
                return;
            }
            if (attempt >= policy.getMaxAttempts()) {
                log.warn("{} failed after {} attempts: {}", operation, attempt, cause.toString());
                result.completeExceptionally(cause);
                return;
            }

            Duration delay = policy.delayAfter(attempt, ThreadLocalRandom.current().nextDouble());
            log.info("{} attempt {} failed ({}), retrying in {}ms",
                operation, attempt, cause.toString(), delay.toMillis());

            Executor next = delay.isZero()
                ? Runnable::run
                : CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS);
            next.execute(() -> attempt(operation, call, attempt + 1, result));
        });
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof MessagingException) {
            return ((MessagingException) error).isRetryable();
        }
        return error instanceof TimeoutException;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
