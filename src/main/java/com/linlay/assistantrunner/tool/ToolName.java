package com.linlay.assistantrunner.tool;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum ToolName {

    CONTACT_CAPTURE("get_client_contact_info", "contact_capture"),
    MANAGER_CALLBACK("request_manager_callback");

    private final String wireName;
    private final List<String> aliases;

    ToolName(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = List.of(aliases);
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ToolName> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ToolName name : values()) {
            if (name.wireName.equals(normalized) || name.aliases.contains(normalized)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
