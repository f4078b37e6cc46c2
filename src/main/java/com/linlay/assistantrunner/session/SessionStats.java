package com.linlay.assistantrunner.session;

public record SessionStats(
        int residentSessions,
        int maxResidentSessions,
        int turnsInFlight,
        int orphanedRuns
) {
}
