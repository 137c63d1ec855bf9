package com.sarkariexams.backend.global.security;

import java.util.UUID;

import com.sarkariexams.backend.modules.auth.domain.AdminRole;

public record AdminPrincipal(UUID userId, UUID sessionId, String email, AdminRole role) {

    public ActorContext toActorContext() {
        return ActorContext.of(userId, sessionId, role);
    }
}
