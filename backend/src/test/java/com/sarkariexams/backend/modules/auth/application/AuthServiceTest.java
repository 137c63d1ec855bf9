package com.sarkariexams.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.SecurityEventLogger;
import com.sarkariexams.backend.modules.auth.application.AuthService.LoginResult;
import com.sarkariexams.backend.modules.auth.domain.AdminRole;
import com.sarkariexams.backend.modules.auth.domain.AdminSession;
import com.sarkariexams.backend.modules.auth.domain.AdminUser;
import com.sarkariexams.backend.modules.auth.domain.AdminUserStatus;
import com.sarkariexams.backend.modules.auth.infrastructure.persistence.AdminUserRepository;
import com.sarkariexams.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-03T10:00:00Z");

    @Mock
    private AdminUserRepository adminUserRepository;

    @Mock
    private AdminSessionService adminSessionService;

    @Mock
    private SessionTokenService sessionTokenService;

    @Mock
    private CsrfTokenService csrfTokenService;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private SecondFactorVerifier secondFactorVerifier;

    private AuthService authService;
    private AdminUser user;

    @BeforeEach
    void setUp() {
        authService = new AuthService(
                adminUserRepository,
                adminSessionService,
                sessionTokenService,
                csrfTokenService,
                passwordEncoder,
                secondFactorVerifier,
                new AuthAttemptLimiter(5, 900, new MutableClock(NOW)),
                new SecurityEventLogger()
        );

        user = new AdminUser();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        user.setEmail("admin@example.com");
        user.setPasswordHash("hash");
        user.setRole(AdminRole.ADMIN);
        user.setStatus(AdminUserStatus.ACTIVE);
    }

    @Test
    void enrolledAccountWithoutCodeGetsNoSession() {
        user.setTwoFactorEnabled(true);
        user.setTwoFactorSecret("JBSWY3DPEHPK3PXP");
        when(adminUserRepository.findByEmailIgnoreCase("admin@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("secret", "hash")).thenReturn(true);

        LoginResult result = authService.login("Admin@Example.com", "secret", null, "10.0.0.1", "curl");

        assertThat(result.twoFactorRequired()).isTrue();
        assertThat(result.sessionToken()).isNull();
        assertThat(result.user()).isNull();
        verify(adminSessionService, never()).open(any(), any(), any());
    }

    @Test
    void passwordOnlyAccountOpensSession() {
        AdminSession session = new AdminSession();
        UUID sessionId = UUID.randomUUID();
        ReflectionTestUtils.setField(session, "id", sessionId);
        OffsetDateTime expiresAt = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).plusHours(12);
        session.setExpiresAt(expiresAt);
        when(adminUserRepository.findByEmailIgnoreCase("admin@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("secret", "hash")).thenReturn(true);
        when(adminSessionService.open(user, "10.0.0.1", "curl")).thenReturn(session);
        when(sessionTokenService.issue(user.getId(), sessionId, expiresAt)).thenReturn("session-jwt");
        when(csrfTokenService.tokenFor(sessionId)).thenReturn("csrf-token");

        LoginResult result = authService.login("admin@example.com", "secret", null, "10.0.0.1", "curl");

        assertThat(result.twoFactorRequired()).isFalse();
        assertThat(result.sessionToken()).isEqualTo("session-jwt");
        assertThat(result.csrfToken()).isEqualTo("csrf-token");
        assertThat(result.user().id()).isEqualTo(user.getId());
    }

    @Test
    void wrongPasswordIsInvalidCredentials() {
        when(adminUserRepository.findByEmailIgnoreCase("admin@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "hash")).thenReturn(false);

        assertThatThrownBy(() -> authService.login("admin@example.com", "wrong", null, null, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(ErrorCodes.INVALID_CREDENTIALS));
    }
}
