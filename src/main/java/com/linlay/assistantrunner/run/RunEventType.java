package com.linlay.assistantrunner.run;

public enum RunEventType {
    POLL_SCHEDULED,
    STATUS_CHANGED,
    TRANSIENT_FAILURE,
    TOOL_OUTPUTS_SUBMITTED,
    TERMINAL
}
