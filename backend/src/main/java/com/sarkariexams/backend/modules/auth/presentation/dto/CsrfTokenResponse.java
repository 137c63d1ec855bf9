package com.sarkariexams.backend.modules.auth.presentation.dto;

public record CsrfTokenResponse(String csrfToken) {
}
