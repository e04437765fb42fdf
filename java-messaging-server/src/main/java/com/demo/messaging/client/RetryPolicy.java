package com.demo.messaging.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Exponential backoff with jitter for write retries.
 *
 * Delay before retry n (1-based) is base * 2^(n-1), capped at maxDelay, plus
 * up to jitter * that delay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    @Builder.Default
    private int maxAttempts = 3;

    @Builder.Default
    private Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    private Duration maxDelay = Duration.ofSeconds(10);

    @Builder.Default
    private double jitter = 0.2;

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public static RetryPolicy immediate(int maxAttempts) {
        return RetryPolicy.builder()
            .maxAttempts(maxAttempts)
            .baseDelay(Duration.ZERO)
            .maxDelay(Duration.ZERO)
            .jitter(0)
            .build();
    }

    /**
     * @param attempt the attempt that just failed, starting at 1
     * @param random uniform value in [0, 1)
     */
    public Duration delayAfter(int attempt, double random) {
        long base = baseDelay.toMillis();
        if (base <= 0) {
            return Duration.ZERO;
        }
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = Math.min(base << exponent, maxDelay.toMillis());
        long jitterMs = (long) (delay * jitter * random);
        return Duration.ofMillis(delay + jitterMs);
    }
}
