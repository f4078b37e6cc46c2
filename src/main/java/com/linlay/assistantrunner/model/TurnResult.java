package com.linlay.assistantrunner.model;

public sealed interface TurnResult permits AssistantReply, TurnError {

    String userId();

    long turnSequence();
}
