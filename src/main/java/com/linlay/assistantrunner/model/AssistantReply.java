package com.linlay.assistantrunner.model;

import java.util.List;

public record AssistantReply(
        String userId,
        long turnSequence,
        String threadId,
        String runId,
        String text,
        List<ExtractedContact> contacts,
        List<EscalationRequest> escalations
) implements TurnResult {

    public AssistantReply {
        contacts = contacts == null ? List.of() : List.copyOf(contacts);
        escalations = escalations == null ? List.of() : List.copyOf(escalations);
    }
}
