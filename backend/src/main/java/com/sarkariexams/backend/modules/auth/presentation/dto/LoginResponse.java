package com.sarkariexams.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record LoginResponse(AdminUserResponse user, String csrfToken, OffsetDateTime expiresAt) {
}
