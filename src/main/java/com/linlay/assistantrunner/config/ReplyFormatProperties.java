package com.linlay.assistantrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "assistant.reply")
public class ReplyFormatProperties {

    private boolean stripAnnotations = true;
    private boolean htmlFormat = false;
    private String fallbackText = "Sorry, no answer could be produced. Please try again.";

    public boolean isStripAnnotations() {
        return stripAnnotations;
    }

    public void setStripAnnotations(boolean stripAnnotations) {
        this.stripAnnotations = stripAnnotations;
    }

    public boolean isHtmlFormat() {
        return htmlFormat;
    }

    public void setHtmlFormat(boolean htmlFormat) {
        this.htmlFormat = htmlFormat;
    }

    public String getFallbackText() {
        return fallbackText;
    }

    public void setFallbackText(String fallbackText) {
        this.fallbackText = fallbackText;
    }
}
