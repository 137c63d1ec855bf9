package com.sarkariexams.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.UUID;

import javax.crypto.Mac;

import com.sarkariexams.backend.global.common.crypto.TokenDigests;
import com.sarkariexams.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.springframework.stereotype.Service;

/**
 * Derives the CSRF token from the session id, so the server can check it without storing it.
 * A request passes when the header equals the cookie and both equal the derived value.
 */
@Service
public class CsrfTokenService {

    private final JwtTokenProvider tokenProvider;

    public CsrfTokenService(JwtTokenProvider tokenProvider) {
        this.tokenProvider = tokenProvider;
    }

    public String tokenFor(UUID sessionId) {
        try {
            Mac mac = Mac.getInstance(tokenProvider.getCsrfKey().getAlgorithm());
            mac.init(tokenProvider.getCsrfKey());
            byte[] digest = mac.doFinal(sessionId.toString().getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("CSRF token derivation failed", ex);
        }
    }

    public boolean matches(UUID sessionId, String headerToken, String cookieToken) {
        if (sessionId == null || headerToken == null || headerToken.isBlank()) {
            return false;
        }
        if (!TokenDigests.constantTimeEquals(headerToken, cookieToken)) {
            return false;
        }
        return TokenDigests.constantTimeEquals(headerToken, tokenFor(sessionId));
    }
}
