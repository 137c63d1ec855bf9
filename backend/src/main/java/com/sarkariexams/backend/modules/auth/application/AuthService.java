package com.sarkariexams.backend.modules.auth.application;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.SecurityEventLogger;
import com.sarkariexams.backend.modules.auth.domain.AdminSession;
import com.sarkariexams.backend.modules.auth.domain.AdminUser;
import com.sarkariexams.backend.modules.auth.infrastructure.persistence.AdminUserRepository;
import com.sarkariexams.backend.modules.auth.presentation.dto.AdminUserResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AuthService {

    private final AdminUserRepository adminUserRepository;
    private final AdminSessionService adminSessionService;
    private final SessionTokenService sessionTokenService;
    private final CsrfTokenService csrfTokenService;
    private final PasswordEncoder passwordEncoder;
    private final SecondFactorVerifier secondFactorVerifier;
    private final AuthAttemptLimiter attemptLimiter;
    private final SecurityEventLogger securityEvents;

    public AuthService(
            AdminUserRepository adminUserRepository,
            AdminSessionService adminSessionService,
            SessionTokenService sessionTokenService,
            CsrfTokenService csrfTokenService,
            PasswordEncoder passwordEncoder,
            SecondFactorVerifier secondFactorVerifier,
            AuthAttemptLimiter attemptLimiter,
            SecurityEventLogger securityEvents
    ) {
        this.adminUserRepository = adminUserRepository;
        this.adminSessionService = adminSessionService;
        this.sessionTokenService = sessionTokenService;
        this.csrfTokenService = csrfTokenService;
        this.passwordEncoder = passwordEncoder;
        this.secondFactorVerifier = secondFactorVerifier;
        this.attemptLimiter = attemptLimiter;
        this.securityEvents = securityEvents;
    }

    /**
     * Password login. A 2FA-enrolled account without a code gets {@link LoginResult#pendingSecondFactor()}
     * and no session.
     */
    public LoginResult login(String email, String password, String code, String ipAddress, String userAgent) {
        String subject = email == null ? null : email.trim().toLowerCase(Locale.ROOT);
        attemptLimiter.assertAllowed(AuthAttemptLimiter.LOGIN, subject);

        AdminUser user = adminUserRepository.findByEmailIgnoreCase(subject == null ? "" : subject)
                .orElseThrow(() -> loginFailed(subject, ipAddress, "unknown_user"));
        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            throw loginFailed(subject, ipAddress, "bad_password");
        }
        if (!user.isActive()) {
            securityEvents.warn("admin_login_failure", Map.of("email", subject, "reason", "disabled"));
            throw new ProblemException(HttpStatus.FORBIDDEN, ErrorCodes.ACCOUNT_DISABLED, "Account is disabled");
        }

        boolean codeSupplied = code != null && !code.isBlank();
        if (user.isTwoFactorEnabled()) {
            if (!codeSupplied) {
                return LoginResult.pendingSecondFactor();
            }
            if (!secondFactorVerifier.verify(user, code)) {
                throw loginFailed(subject, ipAddress, "bad_code");
            }
        }

        attemptLimiter.clearFailures(AuthAttemptLimiter.LOGIN, subject);
        AdminSession session = adminSessionService.open(user, ipAddress, userAgent);
        String sessionToken = sessionTokenService.issue(user.getId(), session.getId(), session.getExpiresAt());
        String csrfToken = csrfTokenService.tokenFor(session.getId());

        securityEvents.info("admin_login_success", Map.of(
                "userId", user.getId(),
                "sessionId", session.getId(),
                "ip", ipAddress == null ? "unknown" : ipAddress
        ));
        return LoginResult.success(AdminUserResponse.from(user), sessionToken, csrfToken, session.getExpiresAt());
    }

    public void logout(UUID sessionId) {
        adminSessionService.logout(sessionId);
    }

    public Duration sessionLifetime() {
        return adminSessionService.absoluteTimeout();
    }

    @Transactional(readOnly = true)
    public AdminUserResponse currentUser(UUID userId) {
        return adminUserRepository.findById(userId)
                .map(AdminUserResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, ErrorCodes.UNAUTHORIZED));
    }

    private ProblemException loginFailed(String subject, String ipAddress, String reason) {
        attemptLimiter.recordFailure(AuthAttemptLimiter.LOGIN, subject);
        securityEvents.warn("admin_login_failure", Map.of(
                "email", subject == null ? "unknown" : subject,
                "ip", ipAddress == null ? "unknown" : ipAddress,
                "reason", reason
        ));
        return new ProblemException(HttpStatus.UNAUTHORIZED, ErrorCodes.INVALID_CREDENTIALS, "Invalid credentials");
    }

    public record LoginResult(
            boolean twoFactorRequired,
            AdminUserResponse user,
            String sessionToken,
            String csrfToken,
            OffsetDateTime expiresAt
    ) {

        static LoginResult pendingSecondFactor() {
            return new LoginResult(true, null, null, null, null);
        }

        static LoginResult success(AdminUserResponse user, String sessionToken, String csrfToken, OffsetDateTime expiresAt) {
            return new LoginResult(false, user, sessionToken, csrfToken, expiresAt);
        }
    }
}
