package com.linlay.assistantrunner.run.policy;

import java.time.Duration;

/**
 * Exponential backoff: {@code base * 2^step}, capped at {@code maxBackoffMs}.
 * Step 0 is the base interval; callers reset the step to 0 whenever the run changes state.
 */
public record BackoffPolicy(
        long baseIntervalMs,
        long maxBackoffMs
) {

    private static final int MAX_SHIFT = 30;

    public BackoffPolicy {
        baseIntervalMs = Math.max(1L, baseIntervalMs);
        maxBackoffMs = Math.max(baseIntervalMs, maxBackoffMs);
    }

    public Duration delayFor(int step) {
        int shift = Math.min(Math.max(0, step), MAX_SHIFT);
        long candidate = baseIntervalMs << shift;
        if (candidate <= 0 || candidate > maxBackoffMs) {
            return Duration.ofMillis(maxBackoffMs);
        }
        return Duration.ofMillis(candidate);
    }
}
