package com.sarkariexams.backend.global.security;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Names and attributes of the admin session cookie (HttpOnly) and its readable CSRF companion.
 */
@Component
public class AdminCookies {

    private final String sessionCookieName;
    private final String csrfCookieName;
    private final boolean secure;

    public AdminCookies(
            @Value("${admin.cookie.name:admin_auth_token}") String sessionCookieName,
            @Value("${admin.csrf.cookie-name:csrf_token}") String csrfCookieName,
            @Value("${admin.cookie.secure:true}") boolean secure
    ) {
        this.sessionCookieName = sessionCookieName;
        this.csrfCookieName = csrfCookieName;
        this.secure = secure;
    }

    public ResponseCookie session(String token, Duration maxAge) {
        return build(sessionCookieName, token, maxAge, true);
    }

    public ResponseCookie csrf(String token, Duration maxAge) {
        return build(csrfCookieName, token, maxAge, false);
    }

    public ResponseCookie clearSession() {
        return build(sessionCookieName, "", Duration.ZERO, true);
    }

    public ResponseCookie clearCsrf() {
        return build(csrfCookieName, "", Duration.ZERO, false);
    }

    public Optional<String> readSession(HttpServletRequest request) {
        return read(request, sessionCookieName);
    }

    public Optional<String> readCsrf(HttpServletRequest request) {
        return read(request, csrfCookieName);
    }

    private ResponseCookie build(String name, String value, Duration maxAge, boolean httpOnly) {
        return ResponseCookie.from(name, value)
                .httpOnly(httpOnly)
                .secure(secure)
                .sameSite("Strict")
                .path("/")
                .maxAge(maxAge)
                .build();
    }

    private static Optional<String> read(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        return Arrays.stream(cookies)
                .filter(cookie -> name.equals(cookie.getName()))
                .map(Cookie::getValue)
                .filter(value -> value != null && !value.isBlank())
                .findFirst();
    }
}
