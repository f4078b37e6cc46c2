package com.linlay.assistantrunner.run;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolCallRequest(
        String id,
        String name,
        Map<String, Object> arguments,
        String rawArguments
) {
    public ToolCallRequest {
        arguments = arguments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        rawArguments = rawArguments == null ? "" : rawArguments;
    }

    public ToolCallRequest(String id, String name, Map<String, Object> arguments) {
        this(id, name, arguments, "");
    }
}
