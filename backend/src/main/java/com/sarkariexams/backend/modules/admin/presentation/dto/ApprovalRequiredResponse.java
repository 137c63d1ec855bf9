package com.sarkariexams.backend.modules.admin.presentation.dto;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.modules.approval.presentation.dto.ApprovalResponse;

public record ApprovalRequiredResponse(
        String error,
        boolean requiresApproval,
        String approvalId,
        String message,
        ApprovalResponse data
) {

    public static ApprovalRequiredResponse of(ApprovalResponse approval) {
        return new ApprovalRequiredResponse(
                ErrorCodes.APPROVAL_REQUIRED,
                true,
                approval.id().toString(),
                "Action queued for approval by a second reviewer",
                approval
        );
    }
}
