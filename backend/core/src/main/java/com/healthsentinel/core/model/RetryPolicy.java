package com.healthsentinel.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Delivery retry settings of one notifier.
 * The delay before attempt {@code k + 1} is {@code initialDelay * backoffMultiplier^(k - 1)}, capped at {@code maxDelay}.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialDelay,
        double backoffMultiplier,
        Duration maxDelay,
        Duration deliveryTimeout
) {
    public static final RetryPolicy DEFAULT = new RetryPolicy(
            3,
            Duration.ofSeconds(1),
            2.0,
            Duration.ofSeconds(60),
            Duration.ofSeconds(30)
    );

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay is required");
        Objects.requireNonNull(maxDelay, "maxDelay is required");
        Objects.requireNonNull(deliveryTimeout, "deliveryTimeout is required");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("retry delays must not be negative");
        }
    }

    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double millis = initialDelay.toMillis() * Math.pow(backoffMultiplier, attempt - 1);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
