package com.sarkariexams.backend.modules.admin.presentation.dto;

import java.util.LinkedHashMap;
import java.util.Map;

import com.sarkariexams.backend.modules.admin.application.AdminPolicyService.UpdatePolicyCommand;
import com.sarkariexams.backend.modules.admin.domain.SecurityPolicy;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record UpdatePolicyRequest(
        @NotNull Boolean dualApprovalRequired,
        @NotNull Boolean breakGlassEnabled,
        @NotNull @Min(1) @Max(500) Integer breakGlassMinReasonLength,
        @NotNull @Min(SecurityPolicy.MIN_STEP_UP_TTL_SECONDS) @Max(3600) Integer stepUpTtlSeconds,
        @NotNull Boolean stepUpSingleUse,
        @NotNull @Min(SecurityPolicy.MIN_APPROVAL_EXPIRY_MINUTES) @Max(10080) Integer approvalExpiryMinutes
) {

    public UpdatePolicyCommand toCommand() {
        return new UpdatePolicyCommand(
                dualApprovalRequired,
                breakGlassEnabled,
                breakGlassMinReasonLength,
                stepUpTtlSeconds,
                stepUpSingleUse,
                approvalExpiryMinutes
        );
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("dualApprovalRequired", dualApprovalRequired);
        payload.put("breakGlassEnabled", breakGlassEnabled);
        payload.put("breakGlassMinReasonLength", breakGlassMinReasonLength);
        payload.put("stepUpTtlSeconds", stepUpTtlSeconds);
        payload.put("stepUpSingleUse", stepUpSingleUse);
        payload.put("approvalExpiryMinutes", approvalExpiryMinutes);
        return payload;
    }
}
