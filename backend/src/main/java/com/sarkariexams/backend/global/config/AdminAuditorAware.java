package com.sarkariexams.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.global.security.AdminPrincipal;
import com.sarkariexams.backend.global.security.SecurityUtils;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;

public class AdminAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        return SecurityUtils.findCurrentPrincipal().map(AdminPrincipal::userId);
    }
}
