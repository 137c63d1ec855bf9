package com.sarkariexams.backend.modules.stepup.presentation.dto;

import java.time.OffsetDateTime;

public record StepUpResponse(String token, OffsetDateTime expiresAt, boolean singleUse) {
}
