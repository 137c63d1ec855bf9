package com.sarkariexams.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.sarkariexams.backend.modules.auth.domain.AdminUser;

public record AdminUserResponse(
        UUID id,
        String email,
        String displayName,
        String role,
        List<String> permissions,
        boolean twoFactorEnabled
) {

    public static AdminUserResponse from(AdminUser user) {
        return new AdminUserResponse(
                user.getId(),
                user.getEmail(),
                user.getDisplayName(),
                user.getRole().code(),
                user.getRole().effectivePermissions().stream().sorted().toList(),
                user.isTwoFactorEnabled()
        );
    }
}
