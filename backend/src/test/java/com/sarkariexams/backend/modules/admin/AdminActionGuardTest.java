package com.sarkariexams.backend.modules.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.global.security.SecurityEventLogger;
import com.sarkariexams.backend.modules.admin.application.AdminActionGuard;
import com.sarkariexams.backend.modules.admin.application.AdminPolicyService;
import com.sarkariexams.backend.modules.admin.application.GateDecision;
import com.sarkariexams.backend.modules.admin.application.GateRequest;
import com.sarkariexams.backend.modules.admin.application.GuardedExecution;
import com.sarkariexams.backend.modules.admin.application.GuardedResult;
import com.sarkariexams.backend.modules.admin.application.PolicyGate;
import com.sarkariexams.backend.modules.admin.domain.GuardedAction;
import com.sarkariexams.backend.modules.admin.domain.RequestIntent;
import com.sarkariexams.backend.modules.admin.domain.SecurityPolicy;
import com.sarkariexams.backend.modules.approval.application.ApprovalLedgerService;
import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;
import com.sarkariexams.backend.modules.approval.domain.ApprovalStatus;
import com.sarkariexams.backend.modules.audit.application.AuditLogService;
import com.sarkariexams.backend.modules.audit.application.AuditLogService.AuditEntry;
import com.sarkariexams.backend.modules.auth.domain.AdminRole;
import com.sarkariexams.backend.modules.stepup.application.StepUpService;
import com.sarkariexams.backend.modules.stepup.application.StepUpService.VerifiedStepUp;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class AdminActionGuardTest {

    private static final SecurityPolicy POLICY = new SecurityPolicy(true, true, 12, 600, true, 30);

    @Mock
    private PolicyGate policyGate;

    @Mock
    private AdminPolicyService adminPolicyService;

    @Mock
    private ApprovalLedgerService approvalLedgerService;

    @Mock
    private StepUpService stepUpService;

    @Mock
    private AuditLogService auditLogService;

    private AdminActionGuard guard;
    private SimpleMeterRegistry meterRegistry;
    private ActorContext actor;
    private VerifiedStepUp stepUp;
    private List<GuardedExecution> executions;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        guard = new AdminActionGuard(policyGate, adminPolicyService, approvalLedgerService, stepUpService,
                auditLogService, new SecurityEventLogger(), meterRegistry, new ObjectMapper());
        actor = ActorContext.of(UUID.randomUUID(), UUID.randomUUID(), AdminRole.EDITOR);
        stepUp = new VerifiedStepUp(UUID.randomUUID(), true, OffsetDateTime.parse("2025-01-01T00:10:00Z"));
        executions = new ArrayList<>();
    }

    @Test
    void allowedActionConsumesStepUpAndRunsCallerPayload() {
        GateRequest request = request(RequestIntent.plain());
        when(policyGate.decide(request, POLICY)).thenReturn(GateDecision.allow(stepUp, Map.of()));

        GuardedResult<Result> result = guard.run(request, POLICY, Result.class, this::mutate);

        assertThat(result.isQueued()).isFalse();
        assertThat(result.data().title()).isEqualTo("from caller");
        assertThat(result.approval()).isNull();
        verify(stepUpService).consume(stepUp);
        assertThat(meterRegistry.counter("admin.gate.decisions", "action", "delete-announcement", "outcome", "allow")
                .count()).isEqualTo(1.0);
    }

    @Test
    void queuedActionDoesNotRunOrSpendStepUp() {
        GateRequest request = request(RequestIntent.plain());
        ApprovalRequest pending = approval(ApprovalStatus.PENDING);
        when(policyGate.decide(request, POLICY)).thenReturn(GateDecision.requireApproval(pending));

        GuardedResult<Result> result = guard.run(request, POLICY, Result.class, this::mutate);

        assertThat(result.isQueued()).isTrue();
        assertThat(result.approval()).isSameAs(pending);
        assertThat(executions).isEmpty();
        verify(stepUpService, never()).consume(any());
    }

    @Test
    void denialIsAuditedDetachedAndRethrown() {
        GateRequest request = request(RequestIntent.withBreakGlass("short"));
        ProblemException problem = new ProblemException(HttpStatus.FORBIDDEN, ErrorCodes.BREAK_GLASS_REASON_TOO_SHORT,
                "too short", ErrorCodes.BREAK_GLASS_REASON_TOO_SHORT);
        when(policyGate.decide(request, POLICY)).thenReturn(GateDecision.deny(problem));

        assertThatThrownBy(() -> guard.run(request, POLICY, Result.class, this::mutate)).isSameAs(problem);

        ArgumentCaptor<AuditEntry> entry = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditLogService).recordDetached(entry.capture());
        assertThat(entry.getValue().action()).isEqualTo("admin_action_denied");
        assertThat(entry.getValue().metadata())
                .containsEntry("error", ErrorCodes.BREAK_GLASS_REASON_TOO_SHORT)
                .containsEntry("breakGlassReason", "short");
        verify(auditLogService, never()).record(any());
        assertThat(executions).isEmpty();
    }

    @Test
    void approvedRequestRunsStoredPayloadAndStoresResult() {
        GateRequest request = request(RequestIntent.withApprovalId(UUID.randomUUID().toString()));
        ApprovalRequest approved = approval(ApprovalStatus.APPROVED);
        approved.setReviewerUserId(UUID.randomUUID());
        approved.setPayload(Map.of("title", "from approval"));
        when(policyGate.decide(request, POLICY)).thenReturn(GateDecision.executeApproved(stepUp, approved));
        when(approvalLedgerService.claimForExecution(approved.getId(), actor.userId())).thenReturn(true);

        GuardedResult<Result> result = guard.run(request, POLICY, Result.class, this::mutate);

        assertThat(result.data().title()).isEqualTo("from approval");
        assertThat(result.approval()).isSameAs(approved);
        assertThat(result.replayed()).isFalse();
        assertThat(executions.get(0).auditMetadata())
                .containsEntry("approvalId", approved.getId().toString())
                .containsEntry("approvedBy", approved.getReviewerUserId().toString());
        verify(approvalLedgerService).storeResult(approved.getId(), Map.of("title", "from approval"));
        verify(stepUpService).consume(stepUp);
    }

    @Test
    void losingTheExecutionClaimReturnsWinnersResult() {
        GateRequest request = request(RequestIntent.withApprovalId(UUID.randomUUID().toString()));
        ApprovalRequest approved = approval(ApprovalStatus.APPROVED);
        ApprovalRequest executed = approval(ApprovalStatus.EXECUTED);
        executed.setResult(Map.of("title", "first run"));
        when(policyGate.decide(request, POLICY)).thenReturn(GateDecision.executeApproved(stepUp, approved));
        when(approvalLedgerService.claimForExecution(approved.getId(), actor.userId())).thenReturn(false);
        when(approvalLedgerService.load(approved.getId())).thenReturn(executed);

        GuardedResult<Result> result = guard.run(request, POLICY, Result.class, this::mutate);

        assertThat(result.replayed()).isTrue();
        assertThat(result.data().title()).isEqualTo("first run");
        assertThat(executions).isEmpty();
        verify(approvalLedgerService, never()).storeResult(any(), any());
        verify(stepUpService, never()).consume(any());
    }

    @Test
    void executedApprovalReplaysWithoutRunning() {
        GateRequest request = request(RequestIntent.withApprovalId(UUID.randomUUID().toString()));
        ApprovalRequest executed = approval(ApprovalStatus.EXECUTED);
        executed.setResult(Map.of("title", "stored"));
        when(policyGate.decide(request, POLICY)).thenReturn(GateDecision.replayExecuted(stepUp, executed));

        GuardedResult<Result> result = guard.run(request, POLICY, Result.class, this::mutate);

        assertThat(result.data()).isEqualTo(new Result("stored"));
        assertThat(result.replayed()).isTrue();
        assertThat(executions).isEmpty();
    }

    @Test
    void breakGlassMetadataReachesMutation() {
        GateRequest request = request(RequestIntent.withBreakGlass("exam postponed by board"));
        when(policyGate.decide(eq(request), any())).thenReturn(GateDecision.allow(stepUp,
                Map.of("breakGlassUsed", true, "breakGlassReason", "exam postponed by board")));
        when(adminPolicyService.current()).thenReturn(POLICY);

        guard.run(request, Result.class, this::mutate);

        GuardedExecution execution = executions.get(0);
        assertThat(execution.breakGlassUsed()).isTrue();
        assertThat(execution.auditMetadataWith(Map.of("status", "deleted")))
                .containsEntry("status", "deleted")
                .containsEntry("breakGlassReason", "exam postponed by board");
    }

    @Test
    void replayTakesTheActionItWasQueuedUnder() {
        String approvalId = UUID.randomUUID().toString();
        when(approvalLedgerService.queuedActionType(approvalId, "announcement:1", "PUT", "/admin/announcements/1"))
                .thenReturn(Optional.of("unpublish-announcement"));

        GuardedAction action = guard.actionFor(RequestIntent.fromHeaders(approvalId, null), "announcement:1",
                "PUT", "/admin/announcements/1", GuardedAction.UPDATE_DRAFT);

        assertThat(action).isEqualTo(GuardedAction.UNPUBLISH_ANNOUNCEMENT);
    }

    @Test
    void unknownApprovalIdKeepsDerivedAction() {
        when(approvalLedgerService.queuedActionType(any(), any(), any(), any())).thenReturn(Optional.empty());

        GuardedAction action = guard.actionFor(RequestIntent.fromHeaders("not-a-uuid", null), "announcement:1",
                "PUT", "/admin/announcements/1", GuardedAction.UPDATE_DRAFT);

        assertThat(action).isEqualTo(GuardedAction.UPDATE_DRAFT);
    }

    @Test
    void plainRequestNeverConsultsLedger() {
        GuardedAction action = guard.actionFor(RequestIntent.plain(), "announcement:1", "PUT",
                "/admin/announcements/1", GuardedAction.UPDATE_TO_PUBLISHED);

        assertThat(action).isEqualTo(GuardedAction.UPDATE_TO_PUBLISHED);
        verify(approvalLedgerService, never()).queuedActionType(any(), any(), any(), any());
    }

    private Result mutate(GuardedExecution execution) {
        executions.add(execution);
        return new Result(String.valueOf(execution.payload().get("title")));
    }

    private GateRequest request(RequestIntent intent) {
        UUID announcementId = UUID.randomUUID();
        return new GateRequest(actor, GuardedAction.DELETE_ANNOUNCEMENT, "announcement:" + announcementId,
                announcementId, intent, "token", Map.of("title", "from caller"), "DELETE",
                "/admin/announcements/" + announcementId, null);
    }

    private static ApprovalRequest approval(ApprovalStatus status) {
        ApprovalRequest approval = new ApprovalRequest();
        approval.setId(UUID.randomUUID());
        approval.setStatus(status);
        return approval;
    }

    public record Result(String title) {
    }
}
