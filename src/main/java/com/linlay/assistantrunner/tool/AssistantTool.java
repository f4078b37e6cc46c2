package com.linlay.assistantrunner.tool;

import java.util.Map;

/**
 * Local handler for one {@link ToolName}. Implementations may block; the dispatcher runs them off
 * the polling scheduler.
 */
public interface AssistantTool {

    ToolName name();

    default String description() {
        return "";
    }

    default Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(),
                "additionalProperties", true
        );
    }

    /**
     * @throws RuntimeException when the arguments cannot be handled
     */
    ToolInvocation invoke(ToolCallContext context, Map<String, Object> args);
}
