package com.sarkariexams.backend.modules.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.modules.admin.application.GateDecision;
import com.sarkariexams.backend.modules.admin.application.GateDecision.Outcome;
import com.sarkariexams.backend.modules.admin.application.GateRequest;
import com.sarkariexams.backend.modules.admin.application.PolicyGate;
import com.sarkariexams.backend.modules.admin.domain.GuardedAction;
import com.sarkariexams.backend.modules.admin.domain.RequestIntent;
import com.sarkariexams.backend.modules.admin.domain.SecurityPolicy;
import com.sarkariexams.backend.modules.approval.application.ApprovalLedgerService;
import com.sarkariexams.backend.modules.approval.application.ApprovalLedgerService.PendingApprovalCommand;
import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;
import com.sarkariexams.backend.modules.approval.domain.ApprovalStatus;
import com.sarkariexams.backend.modules.auth.domain.AdminRole;
import com.sarkariexams.backend.modules.stepup.application.StepUpService;
import com.sarkariexams.backend.modules.stepup.application.StepUpService.VerifiedStepUp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class PolicyGateTest {

    private static final String TOKEN = "step-up-token";
    private static final SecurityPolicy DUAL_ON = new SecurityPolicy(true, true, 12, 600, false, 30);

    @Mock
    private StepUpService stepUpService;

    @Mock
    private ApprovalLedgerService approvalLedgerService;

    private PolicyGate policyGate;
    private ActorContext actor;
    private VerifiedStepUp stepUp;
    private UUID announcementId;

    @BeforeEach
    void setUp() {
        policyGate = new PolicyGate(stepUpService, approvalLedgerService);
        actor = ActorContext.of(UUID.randomUUID(), UUID.randomUUID(), AdminRole.EDITOR);
        stepUp = new VerifiedStepUp(UUID.randomUUID(), false, OffsetDateTime.parse("2025-01-01T00:10:00Z"));
        announcementId = UUID.randomUUID();
    }

    @Test
    void nonSensitiveActionSkipsEveryCheck() {
        GateDecision decision = policyGate.decide(request(GuardedAction.CREATE_DRAFT, RequestIntent.plain(), null), DUAL_ON);

        assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
        verifyNoInteractions(stepUpService, approvalLedgerService);
    }

    @Test
    void missingStepUpIsCheckedBeforeBreakGlass() {
        when(stepUpService.verifyStepUp(actor, null)).thenThrow(stepUpRequired());

        GateDecision decision = policyGate.decide(
                request(GuardedAction.DELETE_ANNOUNCEMENT, RequestIntent.withBreakGlass("server on fire, need it gone"), null),
                DUAL_ON);

        assertThat(decision.outcome()).isEqualTo(Outcome.REQUIRE_STEP_UP);
        assertThat(decision.errorCode()).isEqualTo(ErrorCodes.STEP_UP_REQUIRED);
        assertThat(decision.isDenied()).isTrue();
        verifyNoInteractions(approvalLedgerService);
    }

    @ParameterizedTest
    @EnumSource(value = GuardedAction.class, mode = EnumSource.Mode.EXCLUDE, names = {"CREATE_DRAFT", "UPDATE_DRAFT"})
    void everySensitiveActionWithoutStepUpIsRefused(GuardedAction action) {
        when(stepUpService.verifyStepUp(actor, null)).thenThrow(stepUpRequired());

        GateDecision decision = policyGate.decide(request(action, RequestIntent.plain(), null), DUAL_ON);

        assertThat(action.isSensitive()).isTrue();
        assertThat(decision.outcome()).isEqualTo(Outcome.REQUIRE_STEP_UP);
        assertThat(decision.errorCode()).isEqualTo(ErrorCodes.STEP_UP_REQUIRED);
        verifyNoInteractions(approvalLedgerService);
    }

    @Test
    void sensitiveActionWithoutApprovalClassRunsAfterStepUp() {
        when(stepUpService.verifyStepUp(actor, TOKEN)).thenReturn(stepUp);

        GateDecision decision = policyGate.decide(
                request(GuardedAction.REJECT_ANNOUNCEMENT, RequestIntent.plain(), TOKEN), DUAL_ON);

        assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
        assertThat(decision.stepUp()).isEqualTo(stepUp);
        verifyNoInteractions(approvalLedgerService);
    }

    @Test
    void dualApprovalOffAllowsDirectlyAndIgnoresBreakGlass() {
        when(stepUpService.verifyStepUp(actor, TOKEN)).thenReturn(stepUp);

        GateDecision decision = policyGate.decide(
                request(GuardedAction.DELETE_ANNOUNCEMENT, RequestIntent.withBreakGlass("x"), TOKEN),
                DUAL_ON.withDualApprovalRequired(false));

        assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
        assertThat(decision.auditMetadata()).isEmpty();
    }

    @Test
    void breakGlassDeniedWhenDisabled() {
        when(stepUpService.verifyStepUp(actor, TOKEN)).thenReturn(stepUp);

        GateDecision decision = policyGate.decide(
                request(GuardedAction.DELETE_ANNOUNCEMENT, RequestIntent.withBreakGlass("long enough reason here"), TOKEN),
                DUAL_ON.withBreakGlass(false, 12));

        assertThat(decision.outcome()).isEqualTo(Outcome.DENY);
        assertThat(decision.errorCode()).isEqualTo(ErrorCodes.BREAK_GLASS_DISABLED);
        assertThat(decision.denial().getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void breakGlassReasonLengthIsMeasuredAfterTrimming() {
        when(stepUpService.verifyStepUp(actor, TOKEN)).thenReturn(stepUp);

        GateDecision decision = policyGate.decide(
                request(GuardedAction.DELETE_ANNOUNCEMENT, RequestIntent.fromHeaders(null, "   short   "), TOKEN),
                DUAL_ON);

        assertThat(decision.errorCode()).isEqualTo(ErrorCodes.BREAK_GLASS_REASON_TOO_SHORT);
    }

    @Test
    void breakGlassAllowsAndTagsAudit() {
        when(stepUpService.verifyStepUp(actor, TOKEN)).thenReturn(stepUp);

        GateDecision decision = policyGate.decide(
                request(GuardedAction.UNPUBLISH_ANNOUNCEMENT, RequestIntent.withBreakGlass("exam postponed by board"), TOKEN),
                DUAL_ON);

        assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
        assertThat(decision.auditMetadata())
                .containsEntry("breakGlassUsed", true)
                .containsEntry("breakGlassReason", "exam postponed by board");
        verifyNoInteractions(approvalLedgerService);
    }

    @Test
    void breakGlassReasonIsRecordedAsSent() {
        when(stepUpService.verifyStepUp(actor, TOKEN)).thenReturn(stepUp);
        String header = "  Exam postponed by board  ";

        GateDecision decision = policyGate.decide(
                request(GuardedAction.UNPUBLISH_ANNOUNCEMENT, RequestIntent.fromHeaders(null, header), TOKEN),
                DUAL_ON);

        assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
        assertThat(decision.auditMetadata()).containsEntry("breakGlassReason", header);
    }

    @Test
    void breakGlassWinsOverApprovalIdHeader() {
        RequestIntent intent = RequestIntent.fromHeaders(UUID.randomUUID().toString(), "exam postponed by board");

        assertThat(intent.kind()).isEqualTo(RequestIntent.Kind.WITH_BREAK_GLASS);
        assertThat(intent.approvalId()).isNull();
    }

    @Test
    void plainSensitiveRequestOpensPendingApproval() {
        when(stepUpService.verifyStepUp(actor, TOKEN)).thenReturn(stepUp);
        ApprovalRequest pending = approval(ApprovalStatus.PENDING);
        when(approvalLedgerService.createPending(any(), eq(Duration.ofMinutes(30)))).thenReturn(pending);

        GateDecision decision = policyGate.decide(
                request(GuardedAction.DELETE_ANNOUNCEMENT, RequestIntent.plain(), TOKEN), DUAL_ON);

        assertThat(decision.outcome()).isEqualTo(Outcome.REQUIRE_APPROVAL);
        assertThat(decision.errorCode()).isEqualTo(ErrorCodes.APPROVAL_REQUIRED);
        assertThat(decision.approval()).isSameAs(pending);

        ArgumentCaptor<PendingApprovalCommand> command = ArgumentCaptor.forClass(PendingApprovalCommand.class);
        verify(approvalLedgerService).createPending(command.capture(), eq(Duration.ofMinutes(30)));
        assertThat(command.getValue().actionClass()).isEqualTo("announcement_delete");
        assertThat(command.getValue().targetKey()).isEqualTo("announcement:" + announcementId);
        assertThat(command.getValue().requesterUserId()).isEqualTo(actor.userId());
        verify(stepUpService, never()).consume(any());
    }

    @Test
    void secondPendingForSameTargetIsDenied() {
        when(stepUpService.verifyStepUp(actor, TOKEN)).thenReturn(stepUp);
        when(approvalLedgerService.createPending(any(), any())).thenThrow(new ProblemException(
                HttpStatus.CONFLICT, ErrorCodes.APPROVAL_INVALID, "pending", "invalid_status:pending", "abc"));

        GateDecision decision = policyGate.decide(
                request(GuardedAction.DELETE_ANNOUNCEMENT, RequestIntent.plain(), TOKEN), DUAL_ON);

        assertThat(decision.outcome()).isEqualTo(Outcome.DENY);
        assertThat(decision.denial().getProblemReason()).isEqualTo("invalid_status:pending");
        assertThat(decision.denial().getApprovalId()).isEqualTo("abc");
    }

    @Test
    void approvedRequestIsExecutedAndExecutedOneIsReplayed() {
        when(stepUpService.verifyStepUp(actor, TOKEN)).thenReturn(stepUp);
        ApprovalRequest approved = approval(ApprovalStatus.APPROVED);
        ApprovalRequest executed = approval(ApprovalStatus.EXECUTED);
        String target = "announcement:" + announcementId;
        when(approvalLedgerService.resolveForReplay(approved.getId().toString(), actor.userId(), target,
                "announcement_delete")).thenReturn(approved);
        when(approvalLedgerService.resolveForReplay(executed.getId().toString(), actor.userId(), target,
                "announcement_delete")).thenReturn(executed);

        GateDecision execute = policyGate.decide(request(GuardedAction.DELETE_ANNOUNCEMENT,
                RequestIntent.withApprovalId(approved.getId().toString()), TOKEN), DUAL_ON);
        GateDecision replay = policyGate.decide(request(GuardedAction.DELETE_ANNOUNCEMENT,
                RequestIntent.withApprovalId(executed.getId().toString()), TOKEN), DUAL_ON);

        assertThat(execute.outcome()).isEqualTo(Outcome.EXECUTE_APPROVED);
        assertThat(execute.auditMetadata()).containsEntry("approvalId", approved.getId().toString());
        assertThat(replay.outcome()).isEqualTo(Outcome.REPLAY_EXECUTED);
        verify(approvalLedgerService, never()).createPending(any(), any());
    }

    @Test
    void unusableApprovalIdIsDenied() {
        when(stepUpService.verifyStepUp(actor, TOKEN)).thenReturn(stepUp);
        when(approvalLedgerService.resolveForReplay(any(), any(), any(), any())).thenThrow(new ProblemException(
                HttpStatus.CONFLICT, ErrorCodes.APPROVAL_INVALID, "rejected", "invalid_status:rejected"));

        GateDecision decision = policyGate.decide(request(GuardedAction.DELETE_ANNOUNCEMENT,
                RequestIntent.withApprovalId(UUID.randomUUID().toString()), TOKEN), DUAL_ON);

        assertThat(decision.outcome()).isEqualTo(Outcome.DENY);
        assertThat(decision.errorCode()).isEqualTo(ErrorCodes.APPROVAL_INVALID);
    }

    private GateRequest request(GuardedAction action, RequestIntent intent, String token) {
        return new GateRequest(actor, action, "announcement:" + announcementId, announcementId, intent, token,
                Map.of("note", "n"), "DELETE", "/admin/announcements/" + announcementId, null);
    }

    private static ApprovalRequest approval(ApprovalStatus status) {
        ApprovalRequest approval = new ApprovalRequest();
        approval.setId(UUID.randomUUID());
        approval.setStatus(status);
        return approval;
    }

    private static ProblemException stepUpRequired() {
        return new ProblemException(HttpStatus.FORBIDDEN, ErrorCodes.STEP_UP_REQUIRED, "Step-up required", "missing");
    }
}
