package com.sarkariexams.backend.modules.auth.presentation;

import java.time.Duration;

import com.sarkariexams.backend.global.security.AdminCookies;
import com.sarkariexams.backend.global.security.AdminPrincipal;
import com.sarkariexams.backend.global.security.SecurityUtils;
import com.sarkariexams.backend.global.web.ClientAddresses;
import com.sarkariexams.backend.global.web.DataResponse;
import com.sarkariexams.backend.modules.auth.application.AuthService;
import com.sarkariexams.backend.modules.auth.application.AuthService.LoginResult;
import com.sarkariexams.backend.modules.auth.application.CsrfTokenService;
import com.sarkariexams.backend.modules.auth.presentation.dto.AdminUserResponse;
import com.sarkariexams.backend.modules.auth.presentation.dto.CsrfTokenResponse;
import com.sarkariexams.backend.modules.auth.presentation.dto.LoginRequest;
import com.sarkariexams.backend.modules.auth.presentation.dto.LoginResponse;
import com.sarkariexams.backend.modules.auth.presentation.dto.TwoFactorRequiredResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth", description = "Admin login, logout and CSRF token")
public class AuthController {

    private final AuthService authService;
    private final CsrfTokenService csrfTokenService;
    private final AdminCookies adminCookies;

    public AuthController(AuthService authService, CsrfTokenService csrfTokenService, AdminCookies adminCookies) {
        this.authService = authService;
        this.csrfTokenService = csrfTokenService;
        this.adminCookies = adminCookies;
    }

    @PostMapping("/auth/login")
    @Operation(summary = "Log in", description = "Returns 202 two_factor_required when a 2FA code is needed")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request, HttpServletRequest http) {
        LoginResult result = authService.login(
                request.email(),
                request.password(),
                request.code(),
                ClientAddresses.resolve(http),
                http.getHeader(HttpHeaders.USER_AGENT)
        );
        if (result.twoFactorRequired()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(TwoFactorRequiredResponse.instance());
        }
        Duration maxAge = authService.sessionLifetime();
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, adminCookies.session(result.sessionToken(), maxAge).toString())
                .header(HttpHeaders.SET_COOKIE, adminCookies.csrf(result.csrfToken(), maxAge).toString())
                .body(DataResponse.of(new LoginResponse(result.user(), result.csrfToken(), result.expiresAt())));
    }

    @PostMapping("/auth/logout")
    @Operation(summary = "Log out and clear cookies")
    public ResponseEntity<Void> logout() {
        SecurityUtils.findCurrentPrincipal().ifPresent(principal -> authService.logout(principal.sessionId()));
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, adminCookies.clearSession().toString())
                .header(HttpHeaders.SET_COOKIE, adminCookies.clearCsrf().toString())
                .build();
    }

    @GetMapping("/auth/csrf")
    @Operation(summary = "Re-issue the CSRF token for the current session")
    public ResponseEntity<DataResponse<CsrfTokenResponse>> csrf() {
        AdminPrincipal principal = SecurityUtils.getCurrentPrincipal();
        String token = csrfTokenService.tokenFor(principal.sessionId());
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, adminCookies.csrf(token, authService.sessionLifetime()).toString())
                .body(DataResponse.of(new CsrfTokenResponse(token)));
    }

    @GetMapping("/auth/me")
    @Operation(summary = "Current admin user")
    public ResponseEntity<DataResponse<AdminUserResponse>> me() {
        return ResponseEntity.ok(DataResponse.of(authService.currentUser(SecurityUtils.getCurrentUserId())));
    }
}
