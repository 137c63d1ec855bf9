package com.sarkariexams.backend.modules.admin.application;

import java.util.Map;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;
import com.sarkariexams.backend.modules.stepup.application.StepUpService.VerifiedStepUp;

import org.springframework.http.HttpStatus;

/**
 * Result of {@link PolicyGate#decide}. {@code ALLOW} runs the caller's payload now,
 * {@code EXECUTE_APPROVED} runs the payload stored on an approved request and
 * {@code REPLAY_EXECUTED} returns the stored result of an already executed one.
 */
public record GateDecision(
        Outcome outcome,
        VerifiedStepUp stepUp,
        ApprovalRequest approval,
        Map<String, Object> auditMetadata,
        ProblemException denial
) {

    public enum Outcome {
        ALLOW,
        EXECUTE_APPROVED,
        REPLAY_EXECUTED,
        REQUIRE_STEP_UP,
        REQUIRE_APPROVAL,
        DENY
    }

    public GateDecision {
        auditMetadata = auditMetadata == null ? Map.of() : Map.copyOf(auditMetadata);
    }

    public static GateDecision allow(VerifiedStepUp stepUp, Map<String, Object> auditMetadata) {
        return new GateDecision(Outcome.ALLOW, stepUp, null, auditMetadata, null);
    }

    public static GateDecision executeApproved(VerifiedStepUp stepUp, ApprovalRequest approval) {
        return new GateDecision(Outcome.EXECUTE_APPROVED, stepUp, approval,
                Map.of("approvalId", approval.getId().toString()), null);
    }

    public static GateDecision replayExecuted(VerifiedStepUp stepUp, ApprovalRequest approval) {
        return new GateDecision(Outcome.REPLAY_EXECUTED, stepUp, approval,
                Map.of("approvalId", approval.getId().toString()), null);
    }

    public static GateDecision requireStepUp(ProblemException denial) {
        return new GateDecision(Outcome.REQUIRE_STEP_UP, null, null, null, denial);
    }

    public static GateDecision requireApproval(ApprovalRequest approval) {
        return new GateDecision(Outcome.REQUIRE_APPROVAL, null, approval,
                Map.of("approvalId", approval.getId().toString()), null);
    }

    public static GateDecision deny(ProblemException denial) {
        return new GateDecision(Outcome.DENY, null, null, null, denial);
    }

    public static GateDecision deny(HttpStatus status, String code, String detail) {
        return deny(new ProblemException(status, code, detail, code));
    }

    public boolean isDenied() {
        return outcome == Outcome.DENY || outcome == Outcome.REQUIRE_STEP_UP;
    }

    public String errorCode() {
        if (denial != null) {
            return denial.getCode();
        }
        return outcome == Outcome.REQUIRE_APPROVAL ? ErrorCodes.APPROVAL_REQUIRED : null;
    }
}
