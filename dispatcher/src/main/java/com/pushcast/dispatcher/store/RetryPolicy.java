package com.pushcast.dispatcher.store;

import java.time.Duration;

/**
 * Give-up ceiling and exponential backoff for failed deliveries.
 *
 * @param maxAttempts claims allowed per occurrence before the job is failed
 * @param baseBackoff delay after the first failed attempt
 * @param maxBackoff  cap on the doubled delay
 */
public record RetryPolicy(int maxAttempts, Duration baseBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
    }

    public boolean canRetry(int attemptCount) {
        return attemptCount < maxAttempts;
    }

    /** base · 2^(attempt−1), capped at maxBackoff. */
    public Duration backoff(int attemptCount) {
        int exponent = Math.max(0, attemptCount - 1);
        if (exponent >= 30) {
            return maxBackoff;
        }
        Duration delay = baseBackoff.multipliedBy(1L << exponent);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }
}
