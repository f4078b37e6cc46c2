package com.linlay.assistantrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "assistant.provider")
public class AssistantProviderProperties {

    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey;
    private String assistantId;
    private String betaHeader = "assistants=v2";
    private long connectTimeoutMs = 5_000;
    private long requestTimeoutMs = 30_000;
    private int messagePageSize = 20;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getAssistantId() {
        return assistantId;
    }

    public void setAssistantId(String assistantId) {
        this.assistantId = assistantId;
    }

    public String getBetaHeader() {
        return betaHeader;
    }

    public void setBetaHeader(String betaHeader) {
        this.betaHeader = betaHeader;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getMessagePageSize() {
        return messagePageSize;
    }

    public void setMessagePageSize(int messagePageSize) {
        this.messagePageSize = messagePageSize;
    }
}
