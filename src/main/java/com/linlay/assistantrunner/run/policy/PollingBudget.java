package com.linlay.assistantrunner.run.policy;

import java.time.Duration;

public record PollingBudget(
        long baseIntervalMs,
        long maxBackoffMs,
        long runTimeoutMs,
        int transientRetryBudget,
        long orphanReconcileTimeoutMs
) {

    private static final long DEFAULT_BASE_INTERVAL_MS = 1_000L;
    private static final long DEFAULT_MAX_BACKOFF_MS = 8_000L;
    private static final long DEFAULT_RUN_TIMEOUT_MS = 120_000L;
    private static final int DEFAULT_TRANSIENT_RETRY_BUDGET = 5;
    private static final long DEFAULT_ORPHAN_RECONCILE_TIMEOUT_MS = 15_000L;

    public static final PollingBudget DEFAULT = new PollingBudget(
            DEFAULT_BASE_INTERVAL_MS,
            DEFAULT_MAX_BACKOFF_MS,
            DEFAULT_RUN_TIMEOUT_MS,
            DEFAULT_TRANSIENT_RETRY_BUDGET,
            DEFAULT_ORPHAN_RECONCILE_TIMEOUT_MS
    );

    public PollingBudget {
        baseIntervalMs = baseIntervalMs > 0 ? baseIntervalMs : DEFAULT_BASE_INTERVAL_MS;
        maxBackoffMs = Math.max(baseIntervalMs, maxBackoffMs > 0 ? maxBackoffMs : DEFAULT_MAX_BACKOFF_MS);
        runTimeoutMs = runTimeoutMs > 0 ? runTimeoutMs : DEFAULT_RUN_TIMEOUT_MS;
        transientRetryBudget = Math.max(0, transientRetryBudget);
        orphanReconcileTimeoutMs = orphanReconcileTimeoutMs > 0
                ? orphanReconcileTimeoutMs
                : DEFAULT_ORPHAN_RECONCILE_TIMEOUT_MS;
    }

    public BackoffPolicy backoff() {
        return new BackoffPolicy(baseIntervalMs, maxBackoffMs);
    }

    public RetryPolicy retry() {
        return new RetryPolicy(transientRetryBudget);
    }

    public Duration runTimeout() {
        return Duration.ofMillis(runTimeoutMs);
    }

    public Duration orphanReconcileTimeout() {
        return Duration.ofMillis(orphanReconcileTimeoutMs);
    }
}
