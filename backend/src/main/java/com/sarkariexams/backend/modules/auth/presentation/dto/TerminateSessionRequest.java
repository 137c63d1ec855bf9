package com.sarkariexams.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record TerminateSessionRequest(@NotNull(message = "sessionId is required") UUID sessionId) {
}
