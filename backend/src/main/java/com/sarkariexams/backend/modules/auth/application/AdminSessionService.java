package com.sarkariexams.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.global.security.AdminPrincipal;
import com.sarkariexams.backend.global.security.SecurityEventLogger;
import com.sarkariexams.backend.modules.auth.domain.AdminSession;
import com.sarkariexams.backend.modules.auth.domain.AdminUser;
import com.sarkariexams.backend.modules.auth.infrastructure.persistence.AdminSessionRepository;
import com.sarkariexams.backend.modules.stepup.application.StepUpService;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Session lifecycle: open on login, check and touch on every authenticated request, revoke on
 * logout or termination. Revoking a session also revokes the step-up tokens bound to it.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class AdminSessionService {

    static final String REASON_LOGOUT = "LOGOUT";
    static final String REASON_IDLE = "IDLE_TIMEOUT";
    static final String REASON_EXPIRED = "EXPIRED";
    static final String REASON_TERMINATED = "TERMINATED";
    static final String REASON_USER_INACTIVE = "USER_INACTIVE";

    private final AdminSessionRepository adminSessionRepository;
    private final StepUpService stepUpService;
    private final SecurityEventLogger securityEvents;
    private final Duration idleTimeout;
    private final Duration absoluteTimeout;
    private final Clock clock;

    public AdminSessionService(
            AdminSessionRepository adminSessionRepository,
            StepUpService stepUpService,
            SecurityEventLogger securityEvents,
            @Value("${admin.session.idle-timeout-minutes:30}") long idleTimeoutMinutes,
            @Value("${admin.session.absolute-timeout-hours:12}") long absoluteTimeoutHours,
            Clock clock
    ) {
        this.adminSessionRepository = adminSessionRepository;
        this.stepUpService = stepUpService;
        this.securityEvents = securityEvents;
        this.idleTimeout = Duration.ofMinutes(Math.max(1, idleTimeoutMinutes));
        this.absoluteTimeout = Duration.ofHours(Math.max(1, absoluteTimeoutHours));
        this.clock = clock;
    }

    public AdminSession open(AdminUser user, String ipAddress, String userAgent) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserAgentSummary summary = UserAgentSummary.parse(userAgent);

        AdminSession session = new AdminSession();
        session.setAdminUser(user);
        session.setIssuedAt(now);
        session.setExpiresAt(now.plus(absoluteTimeout));
        session.setLastActivityAt(now);
        session.setIpAddress(truncate(ipAddress, 64));
        session.setUserAgent(truncate(userAgent, 512));
        session.setDevice(summary.device());
        session.setBrowser(summary.browser());
        session.setOs(summary.os());
        return adminSessionRepository.save(session);
    }

    /**
     * Resolves the principal for a session cookie. Fails with {@code session_expired} when the
     * session was revoked, idled out or hit its absolute lifetime.
     */
    public AdminPrincipal authenticate(UUID sessionId, UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        AdminSession session = adminSessionRepository.findWithUserById(sessionId)
                .orElseThrow(() -> sessionExpired("unknown session"));
        AdminUser user = session.getAdminUser();
        if (!user.getId().equals(userId)) {
            throw sessionExpired("session does not belong to token subject");
        }
        if (session.getRevokedAt() != null) {
            throw sessionExpired("session revoked");
        }
        if (!session.getExpiresAt().isAfter(now)) {
            revoke(sessionId, REASON_EXPIRED);
            throw sessionExpired("session reached absolute timeout");
        }
        if (!session.isActiveAt(now, idleTimeout)) {
            revoke(sessionId, REASON_IDLE);
            throw sessionExpired("session idle for too long");
        }
        if (!user.isActive()) {
            revoke(sessionId, REASON_USER_INACTIVE);
            throw sessionExpired("account disabled");
        }
        adminSessionRepository.touch(sessionId, now);
        return new AdminPrincipal(user.getId(), sessionId, user.getEmail(), user.getRole());
    }

    @Transactional(readOnly = true)
    public List<SessionView> listActive(ActorContext actor) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return adminSessionRepository.findActiveByUserId(actor.userId(), now, now.minus(idleTimeout)).stream()
                .map(session -> SessionView.from(session, actor.sessionId(), idleTimeout))
                .toList();
    }

    public void logout(UUID sessionId) {
        revoke(sessionId, REASON_LOGOUT);
    }

    public void terminate(ActorContext actor, UUID sessionId) {
        if (actor.sessionId().equals(sessionId)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, ErrorCodes.CANNOT_TERMINATE_CURRENT_SESSION,
                    "Current session cannot be terminated from this endpoint");
        }
        AdminSession session = adminSessionRepository.findById(sessionId)
                .filter(candidate -> candidate.getAdminUser().getId().equals(actor.userId()))
                .filter(candidate -> candidate.getRevokedAt() == null)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ErrorCodes.SESSION_NOT_FOUND,
                        "Session not found"));
        revoke(session.getId(), REASON_TERMINATED);
        securityEvents.info("admin_session_terminated", Map.of("userId", actor.userId(), "sessionId", sessionId));
    }

    public int terminateOthers(ActorContext actor) {
        List<UUID> others = adminSessionRepository.findOtherOpenSessionIds(actor.userId(), actor.sessionId());
        if (others.isEmpty()) {
            return 0;
        }
        int removed = adminSessionRepository.revokeAll(others, OffsetDateTime.now(clock), REASON_TERMINATED);
        stepUpService.revokeForSessions(others);
        securityEvents.info("admin_session_terminated", Map.of("userId", actor.userId(), "removed", removed));
        return removed;
    }

    public Duration absoluteTimeout() {
        return absoluteTimeout;
    }

    private void revoke(UUID sessionId, String reason) {
        adminSessionRepository.revoke(sessionId, OffsetDateTime.now(clock), reason);
        stepUpService.revokeForSessions(List.of(sessionId));
    }

    private static ProblemException sessionExpired(String detail) {
        return new ProblemException(HttpStatus.UNAUTHORIZED, ErrorCodes.SESSION_EXPIRED, detail);
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }

    public record SessionView(
            UUID id,
            String ipAddress,
            String device,
            String browser,
            String os,
            OffsetDateTime issuedAt,
            OffsetDateTime lastActivityAt,
            OffsetDateTime expiresAt,
            boolean current
    ) {

        static SessionView from(AdminSession session, UUID currentSessionId, Duration idleTimeout) {
            OffsetDateTime idleExpiry = session.getLastActivityAt().plus(idleTimeout);
            OffsetDateTime effectiveExpiry = idleExpiry.isBefore(session.getExpiresAt()) ? idleExpiry : session.getExpiresAt();
            return new SessionView(
                    session.getId(),
                    session.getIpAddress(),
                    session.getDevice(),
                    session.getBrowser(),
                    session.getOs(),
                    session.getIssuedAt(),
                    session.getLastActivityAt(),
                    effectiveExpiry,
                    session.getId().equals(currentSessionId)
            );
        }
    }
}
