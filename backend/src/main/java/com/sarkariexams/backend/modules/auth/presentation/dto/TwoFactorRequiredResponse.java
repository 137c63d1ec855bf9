package com.sarkariexams.backend.modules.auth.presentation.dto;

public record TwoFactorRequiredResponse(String status) {

    public static TwoFactorRequiredResponse instance() {
        return new TwoFactorRequiredResponse("two_factor_required");
    }
}
