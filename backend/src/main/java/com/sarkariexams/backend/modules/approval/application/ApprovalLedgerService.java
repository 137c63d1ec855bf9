package com.sarkariexams.backend.modules.approval.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.SecurityEventLogger;
import com.sarkariexams.backend.modules.approval.domain.ApprovalOutcome;
import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;
import com.sarkariexams.backend.modules.approval.domain.ApprovalStatus;
import com.sarkariexams.backend.modules.approval.infrastructure.ApprovalRequestRepository;
import com.sarkariexams.backend.modules.audit.application.AuditLogService;
import com.sarkariexams.backend.modules.audit.application.AuditLogService.AuditEntry;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns every status transition of {@link ApprovalRequest}. Expiry is enforced lazily on each
 * touch; the scheduled sweep only keeps listings tidy.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class ApprovalLedgerService {

    static final String RESOURCE_TYPE = "approval";
    private static final String INVALID_STATUS_PREFIX = "invalid_status:";

    private final ApprovalRequestRepository approvalRequestRepository;
    private final AuditLogService auditLogService;
    private final SecurityEventLogger securityEvents;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ApprovalLedgerService(
            ApprovalRequestRepository approvalRequestRepository,
            AuditLogService auditLogService,
            SecurityEventLogger securityEvents,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.approvalRequestRepository = approvalRequestRepository;
        this.auditLogService = auditLogService;
        this.securityEvents = securityEvents;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Opens a pending request for the target, or fails with {@code invalid_status:pending} when
     * one is already open. Stale pending rows for the target are expired first so they do not
     * block a new cycle.
     */
    public ApprovalRequest createPending(@NonNull PendingApprovalCommand command, @NonNull Duration expiry) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        approvalRequestRepository.expireStaleForTarget(command.targetKey(), command.actionClass(), now);

        UUID id = UUID.randomUUID();
        int inserted = approvalRequestRepository.insertPendingIfAbsent(
                id,
                command.actionType(),
                command.actionClass(),
                command.targetKey(),
                command.requesterUserId(),
                toJson(command.payload()),
                command.method(),
                command.endpoint(),
                command.note(),
                now,
                now.plus(expiry)
        );
        if (inserted == 0) {
            String existingId = approvalRequestRepository.findPending(command.targetKey(), command.actionClass())
                    .map(existing -> existing.getId().toString())
                    .orElse(null);
            throw invalid(INVALID_STATUS_PREFIX + ApprovalStatus.PENDING.code(), existingId,
                    "An approval request is already pending for this target");
        }

        ApprovalRequest created = load(id);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("approvalId", id.toString());
        metadata.put("actionType", command.actionType());
        metadata.put("targetKey", command.targetKey());
        auditLogService.record(new AuditEntry("create_approval", RESOURCE_TYPE, id.toString(),
                command.announcementId(), command.requesterUserId(), command.note(), metadata));
        securityEvents.info("admin_approval_requested", Map.of(
                "approvalId", id,
                "actionType", command.actionType(),
                "requester", command.requesterUserId()
        ));
        return created;
    }

    /**
     * Moves a pending request to approved or rejected. Exactly one concurrent caller wins; the
     * others see {@code approval_invalid}.
     */
    public ApprovalRequest decide(@NonNull UUID approvalId, @NonNull UUID reviewerUserId,
                                  @NonNull ApprovalOutcome outcome, String note) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        ApprovalRequest request = approvalRequestRepository.findById(approvalId)
                .orElseThrow(() -> deniedDecision(approvalId, reviewerUserId, outcome,
                        invalid("not_found", approvalId.toString(), "Approval request not found")));

        if (request.getRequesterUserId().equals(reviewerUserId)) {
            throw deniedDecision(approvalId, reviewerUserId, outcome, new ProblemException(
                    HttpStatus.FORBIDDEN,
                    ErrorCodes.SELF_APPROVAL_FORBIDDEN,
                    "Requester cannot review their own request",
                    ErrorCodes.SELF_APPROVAL_FORBIDDEN,
                    approvalId.toString()));
        }

        if (request.isPendingPast(now)) {
            approvalRequestRepository.expireStaleForTarget(request.getTargetKey(), request.getActionClass(), now);
            throw deniedDecision(approvalId, reviewerUserId, outcome,
                    invalidStatus(ApprovalStatus.EXPIRED, approvalId));
        }
        if (request.getStatus() != ApprovalStatus.PENDING) {
            throw deniedDecision(approvalId, reviewerUserId, outcome, invalidStatus(request.getStatus(), approvalId));
        }

        int updated = approvalRequestRepository.decide(approvalId, outcome.resultingStatus(), reviewerUserId, note, now);
        if (updated == 0) {
            ApprovalStatus current = load(approvalId).getStatus();
            throw deniedDecision(approvalId, reviewerUserId, outcome, invalidStatus(current, approvalId));
        }

        ApprovalRequest decided = load(approvalId);
        String action = outcome == ApprovalOutcome.APPROVE ? "approve_approval" : "reject_approval";
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("approvalId", approvalId.toString());
        metadata.put("actionType", decided.getActionType());
        metadata.put("requester", decided.getRequesterUserId().toString());
        auditLogService.record(new AuditEntry(action, RESOURCE_TYPE, approvalId.toString(), null,
                reviewerUserId, note, metadata));
        securityEvents.info(outcome == ApprovalOutcome.APPROVE ? "admin_approval_approved" : "admin_approval_rejected",
                Map.of("approvalId", approvalId, "reviewer", reviewerUserId));
        return decided;
    }

    /**
     * Resolves the approval a requester replays. Returns only approved or executed requests that
     * match the target and requester; everything else is {@code approval_invalid}.
     */
    public ApprovalRequest resolveForReplay(String rawApprovalId, UUID requesterUserId,
                                            String targetKey, String actionClass) {
        UUID approvalId = parseId(rawApprovalId);
        if (approvalId == null) {
            throw invalid("not_found", rawApprovalId, "Approval request not found");
        }
        ApprovalRequest request = approvalRequestRepository.findById(approvalId)
                .orElseThrow(() -> invalid("not_found", rawApprovalId, "Approval request not found"));

        if (!request.getTargetKey().equals(targetKey) || !request.getActionClass().equals(actionClass)) {
            throw invalid("target_mismatch", rawApprovalId, "Approval request belongs to a different target");
        }
        if (!request.getRequesterUserId().equals(requesterUserId)) {
            throw invalid("requester_mismatch", rawApprovalId, "Only the original requester may replay this approval");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (request.isPendingPast(now)) {
            approvalRequestRepository.expireStaleForTarget(targetKey, actionClass, now);
            throw invalidStatus(ApprovalStatus.EXPIRED, approvalId);
        }
        if (request.getStatus() != ApprovalStatus.APPROVED && request.getStatus() != ApprovalStatus.EXECUTED) {
            throw invalidStatus(request.getStatus(), approvalId);
        }
        return request;
    }

    /**
     * Claims an approved request for execution. {@code false} means another caller already
     * executed it.
     */
    public boolean claimForExecution(UUID approvalId, UUID executorUserId) {
        return approvalRequestRepository.claimForExecution(approvalId, executorUserId, OffsetDateTime.now(clock)) == 1;
    }

    public void storeResult(UUID approvalId, Map<String, Object> result) {
        approvalRequestRepository.storeResult(approvalId, toJson(result));
        securityEvents.info("admin_approval_executed", Map.of("approvalId", approvalId));
    }

    /**
     * Action type an approval id was queued under, when the id names a request for this target
     * queued through the same endpoint. Empty otherwise; the gate reports bad ids when it
     * resolves the replay.
     */
    @Transactional(readOnly = true)
    public Optional<String> queuedActionType(String rawApprovalId, String targetKey, String method, String endpoint) {
        UUID approvalId = parseId(rawApprovalId);
        if (approvalId == null) {
            return Optional.empty();
        }
        return approvalRequestRepository.findById(approvalId)
                .filter(request -> request.getTargetKey().equals(targetKey))
                .filter(request -> method.equals(request.getMethod()) && endpoint.equals(request.getEndpoint()))
                .map(ApprovalRequest::getActionType);
    }

    public ApprovalRequest load(UUID approvalId) {
        return approvalRequestRepository.findById(approvalId)
                .orElseThrow(() -> invalid("not_found", approvalId.toString(), "Approval request not found"));
    }

    public Page<ApprovalRequest> list(ApprovalStatus status, Pageable pageable) {
        approvalRequestRepository.expireStale(OffsetDateTime.now(clock));
        return approvalRequestRepository.search(status, pageable);
    }

    public int expireStale() {
        return approvalRequestRepository.expireStale(OffsetDateTime.now(clock));
    }

    public int purgeInactiveOlderThan(Duration retention) {
        return approvalRequestRepository.deleteInactiveBefore(OffsetDateTime.now(clock).minus(retention));
    }

    private ProblemException deniedDecision(UUID approvalId, UUID reviewerUserId, ApprovalOutcome outcome,
                                            ProblemException problem) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("approvalId", approvalId.toString());
        metadata.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
        metadata.put("error", problem.getCode());
        Optional.ofNullable(problem.getProblemReason()).ifPresent(reason -> metadata.put("reason", reason));
        auditLogService.recordDetached(new AuditEntry("approval_decision_denied", RESOURCE_TYPE,
                approvalId.toString(), null, reviewerUserId, null, metadata));
        securityEvents.warn("admin_approval_denied", Map.of(
                "approvalId", approvalId,
                "reviewer", reviewerUserId,
                "error", problem.getCode()
        ));
        return problem;
    }

    private static ProblemException invalidStatus(ApprovalStatus status, UUID approvalId) {
        return invalid(INVALID_STATUS_PREFIX + status.code(), approvalId.toString(),
                "Approval request is " + status.code());
    }

    private static ProblemException invalid(String reason, String approvalId, String detail) {
        return new ProblemException(HttpStatus.CONFLICT, ErrorCodes.APPROVAL_INVALID, detail, reason, approvalId);
    }

    private static UUID parseId(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private String toJson(Map<String, Object> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Approval payload is not serializable", ex);
        }
    }

    public record PendingApprovalCommand(
            String actionType,
            String actionClass,
            String targetKey,
            UUID announcementId,
            UUID requesterUserId,
            Map<String, Object> payload,
            String method,
            String endpoint,
            String note
    ) {
    }
}
