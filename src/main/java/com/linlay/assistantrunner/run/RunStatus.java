package com.linlay.assistantrunner.run;

import java.util.Locale;

public enum RunStatus {

    QUEUED("queued", false),
    IN_PROGRESS("in_progress", false),
    REQUIRES_ACTION("requires_action", false),
    CANCELLING("cancelling", false),
    COMPLETED("completed", true),
    FAILED("failed", true),
    CANCELLED("cancelled", true),
    EXPIRED("expired", true);

    private final String wireValue;
    private final boolean terminal;

    RunStatus(String wireValue, boolean terminal) {
        this.wireValue = wireValue;
        this.terminal = terminal;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Maps the service's status string. {@code incomplete} is reported as {@link #FAILED}.
     *
     * @throws IllegalArgumentException for values this client does not know
     */
    public static RunStatus fromWire(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if ("incomplete".equals(normalized)) {
            return FAILED;
        }
        if ("canceled".equals(normalized)) {
            return CANCELLED;
        }
        for (RunStatus status : values()) {
            if (status.wireValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + raw);
    }
}
