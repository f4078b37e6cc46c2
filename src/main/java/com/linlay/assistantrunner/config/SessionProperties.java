package com.linlay.assistantrunner.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "assistant.sessions")
public class SessionProperties {

    @Min(1)
    private int maxResidentSessions = 10_000;
    @Min(1)
    private int historyCapacity = 200;
    // blank keeps the user to thread mapping in memory only
    private String threadDirectoryFile = "./data/threads.json";

    public int getMaxResidentSessions() {
        return maxResidentSessions;
    }

    public void setMaxResidentSessions(int maxResidentSessions) {
        this.maxResidentSessions = maxResidentSessions;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public String getThreadDirectoryFile() {
        return threadDirectoryFile;
    }

    public void setThreadDirectoryFile(String threadDirectoryFile) {
        this.threadDirectoryFile = threadDirectoryFile;
    }
}
