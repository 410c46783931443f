package com.clapgrow.bridge.common.retry;

import java.time.Duration;

/**
 * Attempt budget and exponential backoff schedule for outbound deliveries.
 *
 * <p>When retries are disabled the budget is a single attempt regardless of the
 * configured count. The delay before attempt {@code n + 1} is
 * {@code baseDelay * 2^(n - 1)}; the first attempt is never delayed.
 */
public record RetryPolicy(
    boolean retryEnabled,
    int maxAttempts,
    Duration baseDelay
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be a non-negative duration");
        }
    }

    /**
     * Single attempt, no backoff.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(false, 1, Duration.ZERO);
    }

    public static RetryPolicy of(boolean retryEnabled, int retryCount, Duration baseDelay) {
        return new RetryPolicy(retryEnabled, Math.max(1, retryCount), baseDelay);
    }

    /**
     * Number of attempts a delivery may consume.
     */
    public int attempts() {
        return retryEnabled ? maxAttempts : 1;
    }

    /**
     * Delay to wait before the given 1-based attempt.
     *
     * @param attempt attempt number, starting at 1
     * @return zero for the first attempt, otherwise {@code baseDelay * 2^(attempt - 2)}
     */
    public Duration delayBefore(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        long factor = 1L << Math.min(attempt - 2, 30);
        return baseDelay.multipliedBy(factor);
    }
}
