package com.linlay.assistantrunner.run.policy;

import com.linlay.assistantrunner.client.CallResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3);

    @Test
    void okShouldProceed() {
        assertThat(policy.decide(CallResult.ok("x"), 2)).isEqualTo(RetryDecision.PROCEED);
    }

    @Test
    void transientShouldRetryWithinBudget() {
        CallResult<String> failure = CallResult.transientFailure("getRunStatus", 503, "unavailable");

        assertThat(policy.decide(failure, 0)).isEqualTo(RetryDecision.RETRY);
        assertThat(policy.decide(failure, 2)).isEqualTo(RetryDecision.RETRY);
        assertThat(policy.decide(failure, 3)).isEqualTo(RetryDecision.GIVE_UP);
    }

    @Test
    void zeroBudgetShouldGiveUpOnFirstTransientFailure() {
        CallResult<String> failure = CallResult.transientFailure("createRun", CallResult.NO_STATUS, "reset");

        assertThat(new RetryPolicy(0).decide(failure, 0)).isEqualTo(RetryDecision.GIVE_UP);
    }

    @Test
    void fatalShouldNeverRetry() {
        assertThat(policy.decide(CallResult.fatal("getRunStatus", 401, "bad key"), 0))
                .isEqualTo(RetryDecision.FAIL_FATAL);
    }
}
