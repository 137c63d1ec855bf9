package com.sarkariexams.backend.modules.stepup.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.global.common.crypto.TokenDigests;
import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.global.security.SecurityEventLogger;
import com.sarkariexams.backend.modules.admin.application.AdminPolicyService;
import com.sarkariexams.backend.modules.admin.domain.SecurityPolicy;
import com.sarkariexams.backend.modules.auth.application.AuthAttemptLimiter;
import com.sarkariexams.backend.modules.auth.application.SecondFactorVerifier;
import com.sarkariexams.backend.modules.auth.domain.AdminUser;
import com.sarkariexams.backend.modules.auth.infrastructure.persistence.AdminUserRepository;
import com.sarkariexams.backend.modules.stepup.domain.StepUpGrant;
import com.sarkariexams.backend.modules.stepup.infrastructure.StepUpGrantRepository;

import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Mints and checks step-up tokens. A token proves that the holder re-entered the password (and
 * second factor where enrolled) recently, from this exact session.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class StepUpService {

    private static final int TOKEN_BYTES = 32;

    private final StepUpGrantRepository stepUpGrantRepository;
    private final AdminUserRepository adminUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final SecondFactorVerifier secondFactorVerifier;
    private final AuthAttemptLimiter attemptLimiter;
    private final AdminPolicyService adminPolicyService;
    private final SecurityEventLogger securityEvents;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public StepUpService(
            StepUpGrantRepository stepUpGrantRepository,
            AdminUserRepository adminUserRepository,
            PasswordEncoder passwordEncoder,
            SecondFactorVerifier secondFactorVerifier,
            AuthAttemptLimiter attemptLimiter,
            AdminPolicyService adminPolicyService,
            SecurityEventLogger securityEvents,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.stepUpGrantRepository = stepUpGrantRepository;
        this.adminUserRepository = adminUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.secondFactorVerifier = secondFactorVerifier;
        this.attemptLimiter = attemptLimiter;
        this.adminPolicyService = adminPolicyService;
        this.securityEvents = securityEvents;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public IssuedStepUp issueStepUp(ActorContext actor, String email, String password, String code) {
        String subject = actor.userId().toString();
        attemptLimiter.assertAllowed(AuthAttemptLimiter.STEP_UP, subject);

        AdminUser user = adminUserRepository.findById(actor.userId())
                .filter(AdminUser::isActive)
                .orElseThrow(() -> fail(actor, "user_inactive"));

        if (email == null || !user.getEmail().equalsIgnoreCase(email.trim())) {
            throw fail(actor, "email_mismatch");
        }
        if (password == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            throw fail(actor, "bad_password");
        }

        boolean codeSupplied = code != null && !code.isBlank();
        if (user.isTwoFactorEnabled()) {
            if (!codeSupplied || !secondFactorVerifier.verify(user, code)) {
                throw fail(actor, codeSupplied ? "bad_code" : "code_missing");
            }
        } else if (codeSupplied) {
            count("not_enrolled");
            securityEvents.warn("admin_step_up_failed", Map.of("userId", actor.userId(), "reason", "not_enrolled_mismatch"));
            throw new ProblemException(HttpStatus.BAD_REQUEST, ErrorCodes.NOT_ENROLLED_MISMATCH,
                    "Two-factor code supplied for an account without two-factor enrolment");
        }

        attemptLimiter.clearFailures(AuthAttemptLimiter.STEP_UP, subject);

        SecurityPolicy policy = adminPolicyService.current();
        OffsetDateTime now = OffsetDateTime.now(clock);
        String token = TokenDigests.randomToken(TOKEN_BYTES);

        StepUpGrant grant = new StepUpGrant();
        grant.setTokenHash(TokenDigests.sha256Hex(token));
        grant.setUserId(actor.userId());
        grant.setSessionId(actor.sessionId());
        grant.setIssuedAt(now);
        grant.setExpiresAt(now.plus(policy.stepUpTtl()));
        grant.setSingleUse(policy.stepUpSingleUse());
        stepUpGrantRepository.save(grant);

        count("success");
        securityEvents.info("admin_step_up_success", Map.of(
                "userId", actor.userId(),
                "sessionId", actor.sessionId(),
                "ttlSeconds", policy.stepUpTtlSeconds(),
                "singleUse", policy.stepUpSingleUse()
        ));
        return new IssuedStepUp(token, grant.getExpiresAt(), grant.isSingleUse());
    }

    /**
     * Checks that {@code token} is live and bound to this actor and session. Does not write.
     */
    @Transactional(readOnly = true)
    public VerifiedStepUp verifyStepUp(ActorContext actor, String token) {
        if (token == null || token.isBlank()) {
            throw stepUpRequired("missing");
        }
        Optional<StepUpGrant> found = stepUpGrantRepository.findByTokenHash(TokenDigests.sha256Hex(token.trim()));
        if (found.isEmpty()) {
            throw stepUpRequired("unknown");
        }
        StepUpGrant grant = found.get();
        if (!grant.getUserId().equals(actor.userId()) || !grant.getSessionId().equals(actor.sessionId())) {
            throw stepUpRequired("binding_mismatch");
        }
        if (!grant.isUsableAt(OffsetDateTime.now(clock))) {
            throw stepUpRequired("expired");
        }
        return new VerifiedStepUp(grant.getId(), grant.isSingleUse(), grant.getExpiresAt());
    }

    /**
     * Spends a single-use token. Multi-use tokens are left alone until they expire.
     */
    public void consume(VerifiedStepUp verified) {
        if (verified == null || !verified.singleUse()) {
            return;
        }
        int updated = stepUpGrantRepository.consume(verified.grantId(), OffsetDateTime.now(clock));
        if (updated == 0) {
            throw stepUpRequired("already_used");
        }
    }

    public int revokeForSessions(Collection<UUID> sessionIds) {
        if (sessionIds == null || sessionIds.isEmpty()) {
            return 0;
        }
        return stepUpGrantRepository.revokeBySessionIds(sessionIds, OffsetDateTime.now(clock));
    }

    public int purgeExpired(OffsetDateTime cutoff) {
        return stepUpGrantRepository.deleteExpiredBefore(cutoff);
    }

    private ProblemException fail(ActorContext actor, String reason) {
        attemptLimiter.recordFailure(AuthAttemptLimiter.STEP_UP, actor.userId().toString());
        count("failed");
        securityEvents.warn("admin_step_up_failed", Map.of("userId", actor.userId(), "reason", reason));
        return new ProblemException(HttpStatus.UNAUTHORIZED, ErrorCodes.INVALID_CREDENTIALS, "Invalid credentials");
    }

    private static ProblemException stepUpRequired(String reason) {
        return new ProblemException(HttpStatus.FORBIDDEN, ErrorCodes.STEP_UP_REQUIRED,
                "Step-up authentication required", reason);
    }

    private void count(String result) {
        meterRegistry.counter("admin.step_up.issued", "result", result).increment();
    }

    public record IssuedStepUp(String token, OffsetDateTime expiresAt, boolean singleUse) {
    }

    public record VerifiedStepUp(UUID grantId, boolean singleUse, OffsetDateTime expiresAt) {
    }
}
