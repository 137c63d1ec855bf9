package com.sarkariexams.backend.modules.admin.domain;

import java.time.Duration;

public record SecurityPolicy(
        boolean dualApprovalRequired,
        boolean breakGlassEnabled,
        int breakGlassMinReasonLength,
        int stepUpTtlSeconds,
        boolean stepUpSingleUse,
        int approvalExpiryMinutes
) {

    public static final int MIN_STEP_UP_TTL_SECONDS = 60;
    public static final int MIN_APPROVAL_EXPIRY_MINUTES = 5;

    public SecurityPolicy {
        breakGlassMinReasonLength = Math.max(1, breakGlassMinReasonLength);
        stepUpTtlSeconds = Math.max(MIN_STEP_UP_TTL_SECONDS, stepUpTtlSeconds);
        approvalExpiryMinutes = Math.max(MIN_APPROVAL_EXPIRY_MINUTES, approvalExpiryMinutes);
    }

    public static SecurityPolicy from(AdminPolicy row) {
        return new SecurityPolicy(
                row.isDualApprovalRequired(),
                row.isBreakGlassEnabled(),
                row.getBreakGlassMinReasonLength(),
                row.getStepUpTtlSeconds(),
                row.isStepUpSingleUse(),
                row.getApprovalExpiryMinutes()
        );
    }

    public Duration stepUpTtl() {
        return Duration.ofSeconds(stepUpTtlSeconds);
    }

    public Duration approvalExpiry() {
        return Duration.ofMinutes(approvalExpiryMinutes);
    }

    public SecurityPolicy withDualApprovalRequired(boolean value) {
        return new SecurityPolicy(value, breakGlassEnabled, breakGlassMinReasonLength, stepUpTtlSeconds,
                stepUpSingleUse, approvalExpiryMinutes);
    }

    public SecurityPolicy withBreakGlass(boolean enabled, int minReasonLength) {
        return new SecurityPolicy(dualApprovalRequired, enabled, minReasonLength, stepUpTtlSeconds,
                stepUpSingleUse, approvalExpiryMinutes);
    }
}
