package com.linlay.assistantrunner.run;

import java.util.List;

public record RunSnapshot(
        RunHandle run,
        RunStatus status,
        List<ToolCallRequest> toolCalls,
        String lastError
) {
    public RunSnapshot {
        if (run == null || status == null) {
            throw new IllegalArgumentException("run and status are required");
        }
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static RunSnapshot of(RunHandle run, RunStatus status) {
        return new RunSnapshot(run, status, List.of(), null);
    }
}
