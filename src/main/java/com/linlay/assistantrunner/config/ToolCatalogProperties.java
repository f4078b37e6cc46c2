package com.linlay.assistantrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "assistant.tools")
public class ToolCatalogProperties {

    private List<String> critical = List.of();
    private List<String> disabled = List.of();

    public List<String> getCritical() {
        return critical;
    }

    public void setCritical(List<String> critical) {
        this.critical = critical == null ? List.of() : List.copyOf(critical);
    }

    public List<String> getDisabled() {
        return disabled;
    }

    public void setDisabled(List<String> disabled) {
        this.disabled = disabled == null ? List.of() : List.copyOf(disabled);
    }
}
