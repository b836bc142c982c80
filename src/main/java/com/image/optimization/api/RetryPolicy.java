package com.image.optimization.api;

import java.time.Duration;

/**
 * Bounded retry for processor invocations that throw.
 * Outcomes reporting {@code success=false} are never retried.
 *
 * @param maxAttempts total attempts per item, at least 1
 * @param delay       pause between attempts
 */
public record RetryPolicy(int maxAttempts, Duration delay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
    }

    /**
     * Single attempt, no retry.
     */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO);
    }

    public static RetryPolicy of(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay);
    }

    public boolean isEnabled() {
        return maxAttempts > 1;
    }
}
