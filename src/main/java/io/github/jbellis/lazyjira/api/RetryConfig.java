package io.github.jbellis.lazyjira.api;

import java.time.Duration;

/** Immutable backoff policy. One instance per client. */
public record RetryConfig(int maxRetries, Duration initialDelay, Duration maxDelay, double backoffMultiplier) {

    public static final RetryConfig DEFAULT = new RetryConfig(3, Duration.ofMillis(100), Duration.ofSeconds(10), 2.0);

    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1");
        }
    }

    /** Delay that follows {@code current}: multiplied, then capped at {@link #maxDelay()}. */
    Duration nextDelay(Duration current) {
        double nanos = current.toNanos() * backoffMultiplier;
        if (nanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }
}
