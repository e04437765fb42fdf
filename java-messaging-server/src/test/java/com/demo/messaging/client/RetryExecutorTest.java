package com.demo.messaging.client;

import com.demo.messaging.exception.AuthorizationException;
import com.demo.messaging.exception.TransientException;
import com.demo.messaging.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private final RetryExecutor executor = new RetryExecutor(RetryPolicy.immediate(3));

    @Test
    void retriesTransientFailuresUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.execute("send", () -> attempts.incrementAndGet() < 2
            ? CompletableFuture.<String>failedFuture(new TransientException("connection reset"))
            : CompletableFuture.completedFuture("ok")).join();

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = executor.execute("send", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new TransientException("unavailable"));
        });

        assertThatThrownBy(result::join).hasCauseInstanceOf(TransientException.class);
        assertThat(attempts).hasValue(3);
    }

    @Test
    void timeoutsAreRetried() {
        AtomicInteger attempts = new AtomicInteger();

        executor.execute("send", () -> attempts.incrementAndGet() == 1
            ? CompletableFuture.<String>failedFuture(new TimeoutException())
            : CompletableFuture.completedFuture("ok")).join();

        assertThat(attempts).hasValue(2);
    }

    @Test
    void permanentFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> validation = executor.execute("send", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new ValidationException("too long"));
        });
        CompletableFuture<String> authorization = executor.execute("markRead", () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new AuthorizationException("not a participant"));
        });

        assertThatThrownBy(validation::join).hasCauseInstanceOf(ValidationException.class);
        assertThatThrownBy(authorization::join).hasCauseInstanceOf(AuthorizationException.class);
        assertThat(attempts).hasValue(2);
    }

    @Test
    void wrappedFailuresAreUnwrappedBeforeClassification() {
        Throwable wrapped = new CompletionException(new TransientException("unavailable"));

        assertThat(RetryExecutor.unwrap(wrapped)).isInstanceOf(TransientException.class);
        assertThat(RetryExecutor.isRetryable(RetryExecutor.unwrap(wrapped))).isTrue();
        assertThat(RetryExecutor.isRetryable(new IllegalStateException())).isFalse();
    }

    @Test
    void supplierThatThrowsCountsAsAFailedAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.execute("send", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new TransientException("socket closed");
            }
            return CompletableFuture.completedFuture("ok");
        }).join();

        assertThat(result).isEqualTo("ok");
    }

    @Test
    void backoffDoublesAndIsCapped() {
        RetryPolicy policy = RetryPolicy.builder()
            .baseDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(10))
            .jitter(0.2)
            .build();

        assertThat(policy.delayAfter(1, 0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayAfter(2, 0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayAfter(3, 0)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayAfter(10, 0)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delayAfter(2, 0.5)).isEqualTo(Duration.ofMillis(2200));
        assertThat(RetryPolicy.immediate(3).delayAfter(5, 0.9)).isEqualTo(Duration.ZERO);
    }
}
