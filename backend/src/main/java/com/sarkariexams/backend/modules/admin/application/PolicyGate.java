package com.sarkariexams.backend.modules.admin.application;

import java.util.LinkedHashMap;
import java.util.Map;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.modules.admin.domain.GuardedAction;
import com.sarkariexams.backend.modules.admin.domain.RequestIntent;
import com.sarkariexams.backend.modules.admin.domain.SecurityPolicy;
import com.sarkariexams.backend.modules.approval.application.ApprovalLedgerService;
import com.sarkariexams.backend.modules.approval.application.ApprovalLedgerService.PendingApprovalCommand;
import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;
import com.sarkariexams.backend.modules.approval.domain.ApprovalStatus;
import com.sarkariexams.backend.modules.stepup.application.StepUpService;
import com.sarkariexams.backend.modules.stepup.application.StepUpService.VerifiedStepUp;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Decides whether a guarded admin action runs now, needs step-up, needs a second reviewer or is
 * refused. The order of checks matters: step-up is verified before break-glass or approval
 * handling because both of those are privileged in their own right.
 *
 * <ol>
 *   <li>non-sensitive action: allow</li>
 *   <li>no valid step-up token: require step-up</li>
 *   <li>action without an approval class, or dual approval switched off: allow</li>
 *   <li>break-glass reason present: deny if disabled or too short, otherwise allow and tag the audit</li>
 *   <li>approval id present: execute if approved, replay if executed, deny otherwise</li>
 *   <li>otherwise open a pending approval request</li>
 * </ol>
 */
@Component
public class PolicyGate {

    private final StepUpService stepUpService;
    private final ApprovalLedgerService approvalLedgerService;

    public PolicyGate(StepUpService stepUpService, ApprovalLedgerService approvalLedgerService) {
        this.stepUpService = stepUpService;
        this.approvalLedgerService = approvalLedgerService;
    }

    public GateDecision decide(GateRequest request, SecurityPolicy policy) {
        GuardedAction action = request.action();
        if (!action.isSensitive()) {
            return GateDecision.allow(null, Map.of());
        }

        VerifiedStepUp stepUp;
        try {
            stepUp = stepUpService.verifyStepUp(request.actor(), request.stepUpToken());
        } catch (ProblemException ex) {
            return GateDecision.requireStepUp(ex);
        }

        if (!action.requiresDualApproval() || !policy.dualApprovalRequired()) {
            return GateDecision.allow(stepUp, Map.of());
        }

        RequestIntent intent = request.intent();
        if (intent.kind() == RequestIntent.Kind.WITH_BREAK_GLASS) {
            return breakGlass(intent.breakGlassReason(), policy, stepUp);
        }

        if (intent.kind() == RequestIntent.Kind.WITH_APPROVAL_ID) {
            return replay(request, stepUp);
        }

        try {
            ApprovalRequest created = approvalLedgerService.createPending(new PendingApprovalCommand(
                    action.code(),
                    action.approvalClass(),
                    request.targetKey(),
                    request.announcementId(),
                    request.actor().userId(),
                    request.payload(),
                    request.method(),
                    request.endpoint(),
                    request.note()
            ), policy.approvalExpiry());
            return GateDecision.requireApproval(created);
        } catch (ProblemException ex) {
            return GateDecision.deny(ex);
        }
    }

    private GateDecision breakGlass(String reason, SecurityPolicy policy, VerifiedStepUp stepUp) {
        if (!policy.breakGlassEnabled()) {
            return GateDecision.deny(HttpStatus.FORBIDDEN, ErrorCodes.BREAK_GLASS_DISABLED,
                    "Break-glass override is disabled");
        }
        if (reason.trim().length() < policy.breakGlassMinReasonLength()) {
            return GateDecision.deny(HttpStatus.FORBIDDEN, ErrorCodes.BREAK_GLASS_REASON_TOO_SHORT,
                    "Break-glass reason must be at least " + policy.breakGlassMinReasonLength() + " characters");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("breakGlassUsed", true);
        metadata.put("breakGlassReason", reason);
        return GateDecision.allow(stepUp, metadata);
    }

    private GateDecision replay(GateRequest request, VerifiedStepUp stepUp) {
        ApprovalRequest approval;
        try {
            approval = approvalLedgerService.resolveForReplay(
                    request.intent().approvalId(),
                    request.actor().userId(),
                    request.targetKey(),
                    request.action().approvalClass()
            );
        } catch (ProblemException ex) {
            return GateDecision.deny(ex);
        }
        if (approval.getStatus() == ApprovalStatus.EXECUTED) {
            return GateDecision.replayExecuted(stepUp, approval);
        }
        return GateDecision.executeApproved(stepUp, approval);
    }
}
