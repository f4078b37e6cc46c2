package com.linlay.assistantrunner.model;

public class TurnFailedException extends RuntimeException {

    private final TurnErrorCategory category;

    public TurnFailedException(TurnErrorCategory category, String detail) {
        super(detail);
        this.category = category;
    }

    public TurnFailedException(TurnErrorCategory category, String detail, Throwable cause) {
        super(detail, cause);
        this.category = category;
    }

    public TurnErrorCategory category() {
        return category;
    }
}
