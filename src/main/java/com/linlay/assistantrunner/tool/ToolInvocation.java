package com.linlay.assistantrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.assistantrunner.model.TurnSideEffect;

import java.util.List;

public record ToolInvocation(
        JsonNode output,
        List<TurnSideEffect> sideEffects
) {
    public ToolInvocation {
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
    }

    public static ToolInvocation of(JsonNode output) {
        return new ToolInvocation(output, List.of());
    }
}
