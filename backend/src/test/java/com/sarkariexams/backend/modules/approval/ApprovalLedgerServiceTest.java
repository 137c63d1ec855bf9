package com.sarkariexams.backend.modules.approval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.SecurityEventLogger;
import com.sarkariexams.backend.modules.approval.application.ApprovalLedgerService;
import com.sarkariexams.backend.modules.approval.application.ApprovalLedgerService.PendingApprovalCommand;
import com.sarkariexams.backend.modules.approval.domain.ApprovalOutcome;
import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;
import com.sarkariexams.backend.modules.approval.domain.ApprovalStatus;
import com.sarkariexams.backend.modules.approval.infrastructure.ApprovalRequestRepository;
import com.sarkariexams.backend.modules.audit.application.AuditLogService;
import com.sarkariexams.backend.modules.audit.application.AuditLogService.AuditEntry;
import com.sarkariexams.backend.support.MutableClock;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ApprovalLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2025-05-01T12:00:00Z");
    private static final String TARGET = "announcement:42";
    private static final String CLASS = "announcement_delete";

    @Mock
    private ApprovalRequestRepository approvalRequestRepository;

    @Mock
    private AuditLogService auditLogService;

    private ApprovalLedgerService ledger;
    private UUID requester;
    private UUID reviewer;

    @BeforeEach
    void setUp() {
        ledger = new ApprovalLedgerService(approvalRequestRepository, auditLogService, new SecurityEventLogger(),
                new ObjectMapper(), new MutableClock(NOW));
        requester = UUID.randomUUID();
        reviewer = UUID.randomUUID();
    }

    @Test
    void createPendingStoresPayloadAsJsonAndAuditsRequest() {
        when(approvalRequestRepository.insertPendingIfAbsent(any(), eq("delete-announcement"), eq(CLASS), eq(TARGET),
                eq(requester), eq("{\"note\":\"stale\"}"), eq("DELETE"), eq("/admin/announcements/42"), eq("stale"),
                eq(now()), eq(now().plusMinutes(30)))).thenReturn(1);
        when(approvalRequestRepository.findById(any())).thenAnswer(inv -> Optional.of(
                approval(inv.getArgument(0), ApprovalStatus.PENDING, now().plusMinutes(30))));

        ApprovalRequest created = ledger.createPending(command(), Duration.ofMinutes(30));

        assertThat(created.getStatus()).isEqualTo(ApprovalStatus.PENDING);
        verify(approvalRequestRepository).expireStaleForTarget(TARGET, CLASS, now());
        ArgumentCaptor<AuditEntry> entry = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogService).record(entry.capture());
        assertThat(entry.getValue().action()).isEqualTo("create_approval");
        assertThat(entry.getValue().userId()).isEqualTo(requester);
        assertThat(entry.getValue().metadata()).containsEntry("targetKey", TARGET);
    }

    @Test
    void createPendingConflictPointsAtExistingRequest() {
        ApprovalRequest existing = approval(UUID.randomUUID(), ApprovalStatus.PENDING, now().plusMinutes(10));
        when(approvalRequestRepository.insertPendingIfAbsent(any(), anyString(), anyString(), anyString(), any(),
                any(), any(), any(), any(), any(), any())).thenReturn(0);
        when(approvalRequestRepository.findPending(TARGET, CLASS)).thenReturn(Optional.of(existing));

        assertInvalid(() -> ledger.createPending(command(), Duration.ofMinutes(30)), "invalid_status:pending",
                existing.getId().toString());
        verify(auditLogService, never()).record(any());
    }

    @Test
    void requesterCannotDecideOwnRequest() {
        ApprovalRequest pending = approval(UUID.randomUUID(), ApprovalStatus.PENDING, now().plusMinutes(10));
        when(approvalRequestRepository.findById(pending.getId())).thenReturn(Optional.of(pending));

        assertThatThrownBy(() -> ledger.decide(pending.getId(), requester, ApprovalOutcome.APPROVE, null))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo(ErrorCodes.SELF_APPROVAL_FORBIDDEN);
                });
        verify(approvalRequestRepository, never()).decide(any(), any(), any(), any(), any());

        ArgumentCaptor<AuditEntry> denied = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogService).recordDetached(denied.capture());
        assertThat(denied.getValue().action()).isEqualTo("approval_decision_denied");
        assertThat(denied.getValue().metadata()).containsEntry("error", ErrorCodes.SELF_APPROVAL_FORBIDDEN);
    }

    @Test
    void expiredRequestCannotBeDecided() {
        ApprovalRequest stale = approval(UUID.randomUUID(), ApprovalStatus.PENDING, now());
        when(approvalRequestRepository.findById(stale.getId())).thenReturn(Optional.of(stale));

        assertInvalid(() -> ledger.decide(stale.getId(), reviewer, ApprovalOutcome.APPROVE, null),
                "invalid_status:expired", stale.getId().toString());
        verify(approvalRequestRepository).expireStaleForTarget(TARGET, CLASS, now());
    }

    @Test
    void alreadyDecidedRequestReportsItsStatus() {
        ApprovalRequest rejected = approval(UUID.randomUUID(), ApprovalStatus.REJECTED, now().plusMinutes(10));
        when(approvalRequestRepository.findById(rejected.getId())).thenReturn(Optional.of(rejected));

        assertInvalid(() -> ledger.decide(rejected.getId(), reviewer, ApprovalOutcome.APPROVE, null),
                "invalid_status:rejected", rejected.getId().toString());
    }

    @Test
    void losingTheDecisionRaceReportsTheWinnersStatus() {
        UUID id = UUID.randomUUID();
        ApprovalRequest pending = approval(id, ApprovalStatus.PENDING, now().plusMinutes(10));
        ApprovalRequest approvedByOther = approval(id, ApprovalStatus.APPROVED, now().plusMinutes(10));
        when(approvalRequestRepository.findById(id))
                .thenReturn(Optional.of(pending))
                .thenReturn(Optional.of(approvedByOther));
        when(approvalRequestRepository.decide(id, ApprovalStatus.REJECTED, reviewer, "no", now())).thenReturn(0);

        assertInvalid(() -> ledger.decide(id, reviewer, ApprovalOutcome.REJECT, "no"),
                "invalid_status:approved", id.toString());
    }

    @Test
    void decideRecordsReviewerAndAudits() {
        UUID id = UUID.randomUUID();
        ApprovalRequest pending = approval(id, ApprovalStatus.PENDING, now().plusMinutes(10));
        ApprovalRequest approved = approval(id, ApprovalStatus.APPROVED, now().plusMinutes(10));
        approved.setReviewerUserId(reviewer);
        when(approvalRequestRepository.findById(id))
                .thenReturn(Optional.of(pending))
                .thenReturn(Optional.of(approved));
        when(approvalRequestRepository.decide(id, ApprovalStatus.APPROVED, reviewer, "ok", now())).thenReturn(1);

        ApprovalRequest decided = ledger.decide(id, reviewer, ApprovalOutcome.APPROVE, "ok");

        assertThat(decided.getStatus()).isEqualTo(ApprovalStatus.APPROVED);
        ArgumentCaptor<AuditEntry> entry = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogService).record(entry.capture());
        assertThat(entry.getValue().action()).isEqualTo("approve_approval");
        assertThat(entry.getValue().userId()).isEqualTo(reviewer);
    }

    @Test
    void replayRequiresMatchingTargetAndRequester() {
        UUID id = UUID.randomUUID();
        ApprovalRequest approved = approval(id, ApprovalStatus.APPROVED, now().plusMinutes(10));
        when(approvalRequestRepository.findById(id)).thenReturn(Optional.of(approved));

        assertInvalid(() -> ledger.resolveForReplay(id.toString(), requester, "announcement:other", CLASS),
                "target_mismatch", id.toString());
        assertInvalid(() -> ledger.resolveForReplay(id.toString(), requester, TARGET, "announcement_publish"),
                "target_mismatch", id.toString());
        assertInvalid(() -> ledger.resolveForReplay(id.toString(), reviewer, TARGET, CLASS),
                "requester_mismatch", id.toString());
        assertThat(ledger.resolveForReplay(" " + id + " ", requester, TARGET, CLASS)).isSameAs(approved);
    }

    @Test
    void replayRejectsGarbageAndUnusableStatuses() {
        assertInvalid(() -> ledger.resolveForReplay("not-a-uuid", requester, TARGET, CLASS), "not_found", "not-a-uuid");

        UUID id = UUID.randomUUID();
        ApprovalRequest pending = approval(id, ApprovalStatus.PENDING, now().plusMinutes(10));
        when(approvalRequestRepository.findById(id)).thenReturn(Optional.of(pending));
        assertInvalid(() -> ledger.resolveForReplay(id.toString(), requester, TARGET, CLASS),
                "invalid_status:pending", id.toString());

        pending.setExpiresAt(now().minusSeconds(1));
        assertInvalid(() -> ledger.resolveForReplay(id.toString(), requester, TARGET, CLASS),
                "invalid_status:expired", id.toString());
    }

    @Test
    void executedRequestIsReturnedForReplay() {
        UUID id = UUID.randomUUID();
        ApprovalRequest executed = approval(id, ApprovalStatus.EXECUTED, now().minusMinutes(1));
        when(approvalRequestRepository.findById(id)).thenReturn(Optional.of(executed));

        assertThat(ledger.resolveForReplay(id.toString(), requester, TARGET, CLASS).getStatus())
                .isEqualTo(ApprovalStatus.EXECUTED);
    }

    @Test
    void claimForExecutionIsCompareAndSet() {
        UUID id = UUID.randomUUID();
        when(approvalRequestRepository.claimForExecution(id, requester, now())).thenReturn(1).thenReturn(0);

        assertThat(ledger.claimForExecution(id, requester)).isTrue();
        assertThat(ledger.claimForExecution(id, requester)).isFalse();
    }

    @Test
    void storeResultSerializesMap() {
        UUID id = UUID.randomUUID();

        ledger.storeResult(id, Map.of("deleted", true));
        ledger.storeResult(id, null);

        verify(approvalRequestRepository).storeResult(id, "{\"deleted\":true}");
        verify(approvalRequestRepository).storeResult(eq(id), isNull());
    }

    private PendingApprovalCommand command() {
        return new PendingApprovalCommand("delete-announcement", CLASS, TARGET, null, requester,
                Map.of("note", "stale"), "DELETE", "/admin/announcements/42", "stale");
    }

    private ApprovalRequest approval(UUID id, ApprovalStatus status, OffsetDateTime expiresAt) {
        ApprovalRequest approval = new ApprovalRequest();
        approval.setId(id);
        approval.setActionType("delete-announcement");
        approval.setActionClass(CLASS);
        approval.setTargetKey(TARGET);
        approval.setRequesterUserId(requester);
        approval.setStatus(status);
        approval.setCreatedAt(now().minusMinutes(5));
        approval.setExpiresAt(expiresAt);
        return approval;
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
    }

    private static void assertInvalid(ThrowingCallable call, String reason, String approvalId) {
        assertThatThrownBy(call).isInstanceOfSatisfying(ProblemException.class, ex -> {
            assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
            assertThat(ex.getCode()).isEqualTo(ErrorCodes.APPROVAL_INVALID);
            assertThat(ex.getProblemReason()).isEqualTo(reason);
            assertThat(ex.getApprovalId()).isEqualTo(approvalId);
        });
    }
}
