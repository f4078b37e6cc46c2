package com.linlay.assistantrunner.run.policy;

public enum RetryDecision {
    PROCEED,
    RETRY,
    GIVE_UP,
    FAIL_FATAL
}
