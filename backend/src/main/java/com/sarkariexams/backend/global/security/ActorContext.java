package com.sarkariexams.backend.global.security;

import java.util.Set;
import java.util.UUID;

import com.sarkariexams.backend.modules.auth.domain.AdminRole;

public record ActorContext(UUID userId, UUID sessionId, AdminRole role, Set<String> permissions) {

    public ActorContext {
        if (userId == null || sessionId == null) {
            throw new IllegalArgumentException("userId and sessionId are required");
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public static ActorContext of(UUID userId, UUID sessionId, AdminRole role) {
        return new ActorContext(userId, sessionId, role, role.effectivePermissions());
    }

    public boolean hasPermission(String permission) {
        return role != null ? role.hasPermission(permission) : permissions.contains(permission);
    }
}
