package com.linlay.assistantrunner.model;

public record EscalationRequest(
        String userId,
        String threadId,
        String reason
) implements TurnSideEffect {
}
