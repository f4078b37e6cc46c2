package com.linlay.assistantrunner.tool;

import com.linlay.assistantrunner.model.TurnSideEffect;
import com.linlay.assistantrunner.run.ToolCallResult;

import java.util.List;

public record DispatchBatch(
        List<ToolCallResult> results,
        List<TurnSideEffect> sideEffects
) {
    public DispatchBatch {
        results = results == null ? List.of() : List.copyOf(results);
        sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
    }
}
