package com.linlay.assistantrunner.model.api;

import jakarta.validation.constraints.NotBlank;

public record TurnRequest(
        @NotBlank
        String userId,
        @NotBlank
        String text
) {
}
