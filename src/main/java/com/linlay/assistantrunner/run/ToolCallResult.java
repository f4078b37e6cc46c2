package com.linlay.assistantrunner.run;

public record ToolCallResult(
        String toolCallId,
        String output
) {
}
