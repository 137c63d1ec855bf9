package com.sarkariexams.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.modules.auth.application.AdminSessionService;
import com.sarkariexams.backend.modules.auth.application.SessionTokenService;
import com.sarkariexams.backend.modules.auth.application.SessionTokenService.InvalidTokenException;
import com.sarkariexams.backend.modules.auth.application.SessionTokenService.ParsedSessionToken;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying the admin session cookie. The JWT only names the session; the
 * stored session row decides whether it is still alive. A failed check leaves the request
 * anonymous and records the reason for {@link RestAuthenticationEntryPoint}.
 */
@Component
public class SessionCookieAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTRIBUTE = SessionCookieAuthenticationFilter.class.getName() + ".error";

    private static final Logger log = LoggerFactory.getLogger(SessionCookieAuthenticationFilter.class);

    private final AdminCookies adminCookies;
    private final SessionTokenService sessionTokenService;
    private final AdminSessionService adminSessionService;

    public SessionCookieAuthenticationFilter(
            AdminCookies adminCookies,
            SessionTokenService sessionTokenService,
            AdminSessionService adminSessionService
    ) {
        this.adminCookies = adminCookies;
        this.sessionTokenService = sessionTokenService;
        this.adminSessionService = adminSessionService;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        Optional<String> token = adminCookies.readSession(request);
        if (token.isPresent() && SecurityContextHolder.getContext().getAuthentication() == null) {
            try {
                ParsedSessionToken parsed = sessionTokenService.parse(token.get());
                AdminPrincipal principal = adminSessionService.authenticate(parsed.sessionId(), parsed.userId());

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, null, authoritiesOf(principal));
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (InvalidTokenException ex) {
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, ErrorCodes.UNAUTHORIZED);
                log.debug("rejected admin session cookie: {}", ex.getMessage());
            } catch (ProblemException ex) {
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, ex.getCode());
                log.debug("admin session not usable: {}", ex.getDetailMessage());
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getServletPath();
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        return path.startsWith("/actuator/health") || path.startsWith("/swagger-ui") || path.startsWith("/v3/api-docs");
    }

    private static List<SimpleGrantedAuthority> authoritiesOf(AdminPrincipal principal) {
        List<SimpleGrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_" + principal.role().name()));
        principal.role().effectivePermissions().stream()
                .sorted()
                .map(SimpleGrantedAuthority::new)
                .forEach(authorities::add);
        return authorities;
    }
}
