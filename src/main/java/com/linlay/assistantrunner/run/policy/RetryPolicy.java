package com.linlay.assistantrunner.run.policy;

import com.linlay.assistantrunner.client.CallResult;

/**
 * Pure retry decision over a client result. {@code priorFailures} is the number of consecutive
 * transient failures already observed for the same call before {@code result}.
 */
public record RetryPolicy(int transientRetryBudget) {

    public RetryPolicy {
        transientRetryBudget = Math.max(0, transientRetryBudget);
    }

    public RetryDecision decide(CallResult<?> result, int priorFailures) {
        if (result == null) {
            return RetryDecision.FAIL_FATAL;
        }
        if (result instanceof CallResult.Ok<?>) {
            return RetryDecision.PROCEED;
        }
        if (result instanceof CallResult.Transient<?>) {
            return priorFailures + 1 > transientRetryBudget ? RetryDecision.GIVE_UP : RetryDecision.RETRY;
        }
        return RetryDecision.FAIL_FATAL;
    }
}
