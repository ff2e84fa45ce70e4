package com.ivamare.eventsourcing.policy;

import java.util.List;

/**
 * Policy for retrying a command after a concurrency conflict.
 *
 * @param maxAttempts Maximum number of attempts, including the first one
 * @param backoffScheduleMs Delay in milliseconds before each retry
 */
public record RetryPolicy(
    int maxAttempts,
    List<Integer> backoffScheduleMs
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        backoffScheduleMs = backoffScheduleMs == null ? List.of() : List.copyOf(backoffScheduleMs);
    }

    /**
     * Default retry policy: 3 attempts with backoff [10, 50, 100] ms.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, List.of(10, 50, 100));
    }

    /**
     * Create a policy with no retries.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, List.of());
    }

    /**
     * Get the delay before the attempt following {@code attempt}.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return Delay in milliseconds, 0 if no more retries
     */
    public long getBackoffMs(int attempt) {
        if (attempt >= maxAttempts || backoffScheduleMs.isEmpty()) {
            return 0;
        }

        int index = Math.max(attempt - 1, 0);
        if (index < backoffScheduleMs.size()) {
            return backoffScheduleMs.get(index);
        }

        // Use last value for attempts beyond schedule
        return backoffScheduleMs.get(backoffScheduleMs.size() - 1);
    }

    /**
     * Check if another attempt should be made.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return true if more attempts are allowed
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }
}
