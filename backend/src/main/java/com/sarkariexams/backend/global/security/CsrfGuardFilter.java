package com.sarkariexams.backend.global.security;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemResponse;
import com.sarkariexams.backend.modules.auth.application.CsrfTokenService;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Double-submit CSRF check for authenticated state-changing requests. Runs after session
 * authentication and before any controller, so a rejected request never reaches step-up or
 * approval logic.
 */
@Component
public class CsrfGuardFilter extends OncePerRequestFilter {

    public static final String CSRF_HEADER = "X-CSRF-Token";

    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");
    private static final String LOGIN_PATH = "/auth/login";

    private final CsrfTokenService csrfTokenService;
    private final AdminCookies adminCookies;
    private final SecurityEventLogger securityEvents;
    private final ObjectMapper objectMapper;

    public CsrfGuardFilter(
            CsrfTokenService csrfTokenService,
            AdminCookies adminCookies,
            SecurityEventLogger securityEvents,
            ObjectMapper objectMapper
    ) {
        this.csrfTokenService = csrfTokenService;
        this.adminCookies = adminCookies;
        this.securityEvents = securityEvents;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        Optional<AdminPrincipal> principal = SecurityUtils.findCurrentPrincipal();
        if (principal.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        String header = request.getHeader(CSRF_HEADER);
        String cookie = adminCookies.readCsrf(request).orElse(null);
        if (!csrfTokenService.matches(principal.get().sessionId(), header, cookie)) {
            securityEvents.warn("csrf_rejected", Map.of(
                    "userId", principal.get().userId(),
                    "method", request.getMethod(),
                    "path", request.getRequestURI(),
                    "headerPresent", header != null
            ));
            reject(request, response);
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return SAFE_METHODS.contains(request.getMethod().toUpperCase(Locale.ROOT))
                || LOGIN_PATH.equals(request.getServletPath());
    }

    private void reject(HttpServletRequest request, HttpServletResponse response) throws IOException {
        ProblemResponse body = ProblemResponse.of(HttpStatus.FORBIDDEN, ErrorCodes.CSRF_INVALID,
                "CSRF token missing or invalid", request.getRequestURI());
        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
