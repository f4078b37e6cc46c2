package com.linlay.assistantrunner.tool;

public record ToolCallContext(
        String userId,
        String threadId,
        String toolCallId
) {
}
