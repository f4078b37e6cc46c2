package com.linlay.assistantrunner.run;

import java.time.Duration;

public record RunEvent(
        RunEventType type,
        String userId,
        RunHandle run,
        RunStatus status,
        Duration delay,
        String detail
) {

    public static RunEvent pollScheduled(String userId, RunHandle run, RunStatus status, Duration delay) {
        return new RunEvent(RunEventType.POLL_SCHEDULED, userId, run, status, delay, null);
    }

    public static RunEvent statusChanged(String userId, RunHandle run, RunStatus previous, RunStatus current) {
        return new RunEvent(RunEventType.STATUS_CHANGED, userId, run, current, null,
                previous.wireValue() + " -> " + current.wireValue());
    }

    public static RunEvent transientFailure(String userId, RunHandle run, RunStatus status, String detail) {
        return new RunEvent(RunEventType.TRANSIENT_FAILURE, userId, run, status, null, detail);
    }

    public static RunEvent toolOutputsSubmitted(String userId, RunHandle run, RunStatus status, int outputs) {
        return new RunEvent(RunEventType.TOOL_OUTPUTS_SUBMITTED, userId, run, status, null, "outputs=" + outputs);
    }

    public static RunEvent terminal(String userId, RunHandle run, RunStatus status, String detail) {
        return new RunEvent(RunEventType.TERMINAL, userId, run, status, null, detail);
    }
}
