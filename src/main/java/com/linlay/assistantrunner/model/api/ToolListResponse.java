package com.linlay.assistantrunner.model.api;

import java.util.List;
import java.util.Map;

public record ToolListResponse(
        List<ToolSummary> tools
) {
    public record ToolSummary(
            String name,
            String description,
            boolean critical,
            Map<String, Object> parameters
    ) {
    }
}
