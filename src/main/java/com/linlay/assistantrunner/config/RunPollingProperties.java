package com.linlay.assistantrunner.config;

import com.linlay.assistantrunner.run.policy.PollingBudget;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "assistant.polling")
public class RunPollingProperties {

    @Min(1)
    private long baseIntervalMs = 1_000;
    @Min(1)
    private long maxBackoffMs = 8_000;
    @Min(1)
    private long runTimeoutMs = 120_000;
    @Min(0)
    private int transientRetryBudget = 5;
    @Min(1)
    private long orphanReconcileTimeoutMs = 15_000;

    public PollingBudget toBudget() {
        return new PollingBudget(
                baseIntervalMs,
                maxBackoffMs,
                runTimeoutMs,
                transientRetryBudget,
                orphanReconcileTimeoutMs
        );
    }

    public long getBaseIntervalMs() {
        return baseIntervalMs;
    }

    public void setBaseIntervalMs(long baseIntervalMs) {
        this.baseIntervalMs = baseIntervalMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public long getRunTimeoutMs() {
        return runTimeoutMs;
    }

    public void setRunTimeoutMs(long runTimeoutMs) {
        this.runTimeoutMs = runTimeoutMs;
    }

    public int getTransientRetryBudget() {
        return transientRetryBudget;
    }

    public void setTransientRetryBudget(int transientRetryBudget) {
        this.transientRetryBudget = transientRetryBudget;
    }

    public long getOrphanReconcileTimeoutMs() {
        return orphanReconcileTimeoutMs;
    }

    public void setOrphanReconcileTimeoutMs(long orphanReconcileTimeoutMs) {
        this.orphanReconcileTimeoutMs = orphanReconcileTimeoutMs;
    }
}
