package com.sarkariexams.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<AdminPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AdminPrincipal principal)) {
            return Optional.empty();
        }
        return Optional.of(principal);
    }

    public static AdminPrincipal getCurrentPrincipal() {
        return findCurrentPrincipal()
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, ErrorCodes.UNAUTHORIZED));
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    public static ActorContext currentActor() {
        return getCurrentPrincipal().toActorContext();
    }
}
