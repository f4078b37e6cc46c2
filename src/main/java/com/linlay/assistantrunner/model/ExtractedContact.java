package com.linlay.assistantrunner.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ExtractedContact(
        String userId,
        String threadId,
        String name,
        String phone,
        String email,
        String comment,
        Map<String, Object> raw
) implements TurnSideEffect {

    public ExtractedContact {
        raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }
}
