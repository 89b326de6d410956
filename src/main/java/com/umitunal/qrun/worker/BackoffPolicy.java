package com.umitunal.qrun.worker;

/**
 * Delay before a failed job becomes available again.
 */
@FunctionalInterface
public interface BackoffPolicy {

    int MAX_DELAY_SECONDS = 3600;

    /**
     * @param attempts attempts made so far, including the one that just failed
     * @return delay in seconds
     */
    int delayFor(int attempts);

    /**
     * {@code min(2^attempts, 3600)}: 2s after the first attempt, 4s after the second, capped at an hour.
     */
    static BackoffPolicy exponential() {
        return attempts -> {
            if (attempts >= 12) {
                return MAX_DELAY_SECONDS;
            }
            return Math.min(1 << Math.max(attempts, 0), MAX_DELAY_SECONDS);
        };
    }

    /**
     * Retry immediately.
     */
    static BackoffPolicy none() {
        return attempts -> 0;
    }
}
