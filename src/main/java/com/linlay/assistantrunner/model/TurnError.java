package com.linlay.assistantrunner.model;

public record TurnError(
        String userId,
        long turnSequence,
        TurnErrorCategory category,
        String detail
) implements TurnResult {

    public TurnError {
        if (category == null) {
            throw new IllegalArgumentException("category is required");
        }
        detail = detail == null ? "" : detail;
    }
}
