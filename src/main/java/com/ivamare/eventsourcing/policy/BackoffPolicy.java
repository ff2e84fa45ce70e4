package com.ivamare.eventsourcing.policy;

import java.time.Duration;
import java.time.Instant;

/**
 * Capped exponential backoff used by the outbox for redelivery and for storage errors.
 *
 * <p>The delay never decreases as the attempt count grows and never exceeds
 * {@code maxBackoffMs}. No jitter is applied.
 *
 * @param initialBackoffMs Delay after the first failure
 * @param maxBackoffMs Upper bound for any delay
 * @param multiplier Growth factor per failure, at least 1.0
 */
public record BackoffPolicy(
    long initialBackoffMs,
    long maxBackoffMs,
    double multiplier
) {
    public BackoffPolicy {
        if (initialBackoffMs < 0) {
            throw new IllegalArgumentException("initialBackoffMs must be >= 0");
        }
        if (maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("maxBackoffMs must be >= initialBackoffMs");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, was " + multiplier);
        }
    }

    /**
     * Default backoff: 1s doubling up to 60s.
     */
    public static BackoffPolicy defaultPolicy() {
        return new BackoffPolicy(1_000, 60_000, 2.0);
    }

    /**
     * Calculate the delay after a number of consecutive failures.
     *
     * @param failures consecutive failure count (1-based)
     * @return delay in milliseconds
     */
    public long delayMs(int failures) {
        if (failures <= 1) {
            return initialBackoffMs;
        }
        double delay = initialBackoffMs * Math.pow(multiplier, failures - 1);
        if (Double.isInfinite(delay) || delay >= maxBackoffMs) {
            return maxBackoffMs;
        }
        return (long) delay;
    }

    public Duration delay(int failures) {
        return Duration.ofMillis(delayMs(failures));
    }

    /**
     * The earliest time of the next attempt after {@code failures} failures.
     */
    public Instant nextAttemptAt(Instant now, int failures) {
        return now.plusMillis(delayMs(failures));
    }
}
