package com.linlay.assistantrunner.session;

import com.linlay.assistantrunner.model.TurnErrorCategory;

import java.time.Instant;

public record TurnRecord(
        String userId,
        long turnSequence,
        String threadId,
        String runId,
        boolean success,
        TurnErrorCategory category,
        Instant startedAt,
        long durationMs,
        int toolRounds
) {
}
