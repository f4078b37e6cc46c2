package com.linlay.assistantrunner.tool;

import com.linlay.assistantrunner.model.TurnSideEffect;

import java.util.List;

/**
 * Aborts a whole tool round: unknown tool, or a failing critical tool. Side effects of tools that
 * already ran in the round are kept so they can still be delivered.
 */
public class ToolDispatchException extends RuntimeException {

    private final String toolName;
    private final List<TurnSideEffect> sideEffects;

    public ToolDispatchException(String toolName, String message) {
        this(toolName, message, null, List.of());
    }

    public ToolDispatchException(String toolName, String message, Throwable cause, List<TurnSideEffect> sideEffects) {
        super(message, cause);
        this.toolName = toolName;
        this.sideEffects = sideEffects == null ? List.of() : List.copyOf(sideEffects);
    }

    public String toolName() {
        return toolName;
    }

    public List<TurnSideEffect> sideEffects() {
        return sideEffects;
    }
}
