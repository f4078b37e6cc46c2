package com.linlay.assistantrunner.model;

public sealed interface TurnSideEffect permits ExtractedContact, EscalationRequest {

    String userId();

    String threadId();
}
