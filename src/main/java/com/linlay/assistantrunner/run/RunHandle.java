package com.linlay.assistantrunner.run;

import org.springframework.util.StringUtils;

public record RunHandle(
        String threadId,
        String runId
) {
    public RunHandle {
        if (!StringUtils.hasText(threadId) || !StringUtils.hasText(runId)) {
            throw new IllegalArgumentException("threadId and runId are required");
        }
        threadId = threadId.trim();
        runId = runId.trim();
    }
}
