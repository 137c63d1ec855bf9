package com.sarkariexams.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.sarkariexams.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.springframework.stereotype.Service;

/**
 * Signs and parses the value of the session cookie. The token names the session row; whether
 * that session is still alive is decided against the database, not the token.
 */
@Service
public class SessionTokenService {

    private static final String SESSION_ID_CLAIM = "sid";

    private final JwtTokenProvider tokenProvider;
    private final Clock clock;

    public SessionTokenService(JwtTokenProvider tokenProvider, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.clock = clock;
    }

    public String issue(UUID userId, UUID sessionId, OffsetDateTime expiresAt) {
        Instant now = clock.instant();
        SecretKey key = tokenProvider.getSessionKey();
        return Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt.toInstant()))
                .claim(SESSION_ID_CLAIM, sessionId.toString())
                .signWith(key, SIG.HS256)
                .compact();
    }

    public ParsedSessionToken parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSessionKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            String sessionId = claims.get(SESSION_ID_CLAIM, String.class);
            if (sessionId == null) {
                throw new InvalidTokenException("Session token has no session id", null);
            }
            return new ParsedSessionToken(UUID.fromString(claims.getSubject()), UUID.fromString(sessionId));
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid session token", e);
        }
    }

    public record ParsedSessionToken(UUID userId, UUID sessionId) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
