package com.sarkariexams.backend.modules.admin.presentation.dto;

import com.sarkariexams.backend.modules.admin.domain.SecurityPolicy;

public record PolicyResponse(
        boolean dualApprovalRequired,
        boolean breakGlassEnabled,
        int breakGlassMinReasonLength,
        int stepUpTtlSeconds,
        boolean stepUpSingleUse,
        int approvalExpiryMinutes
) {

    public static PolicyResponse from(SecurityPolicy policy) {
        return new PolicyResponse(
                policy.dualApprovalRequired(),
                policy.breakGlassEnabled(),
                policy.breakGlassMinReasonLength(),
                policy.stepUpTtlSeconds(),
                policy.stepUpSingleUse(),
                policy.approvalExpiryMinutes()
        );
    }
}
