package com.sarkariexams.backend.modules.admin.application;

import java.util.UUID;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.modules.admin.domain.AdminPolicy;
import com.sarkariexams.backend.modules.admin.domain.SecurityPolicy;
import com.sarkariexams.backend.modules.admin.infrastructure.AdminPolicyRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and replaces the runtime security policy. Without a stored row the boot-time defaults
 * from configuration apply.
 */
@Service
public class AdminPolicyService {

    private static final Logger log = LoggerFactory.getLogger(AdminPolicyService.class);

    private final AdminPolicyRepository adminPolicyRepository;
    private final SecurityPolicy defaults;

    public AdminPolicyService(
            AdminPolicyRepository adminPolicyRepository,
            @Value("${admin.approval.dual-approval-required:true}") boolean dualApprovalRequired,
            @Value("${admin.break-glass.enabled:false}") boolean breakGlassEnabled,
            @Value("${admin.break-glass.min-reason-length:12}") int breakGlassMinReasonLength,
            @Value("${admin.step-up.ttl-seconds:600}") int stepUpTtlSeconds,
            @Value("${admin.step-up.single-use:false}") boolean stepUpSingleUse,
            @Value("${admin.approval.expiry-minutes:30}") int approvalExpiryMinutes
    ) {
        this.adminPolicyRepository = adminPolicyRepository;
        this.defaults = new SecurityPolicy(
                dualApprovalRequired,
                breakGlassEnabled,
                breakGlassMinReasonLength,
                stepUpTtlSeconds,
                stepUpSingleUse,
                approvalExpiryMinutes
        );
    }

    @Transactional(readOnly = true)
    public SecurityPolicy current() {
        return adminPolicyRepository.findCurrent()
                .map(SecurityPolicy::from)
                .orElse(defaults);
    }

    public SecurityPolicy defaults() {
        return defaults;
    }

    @Transactional
    public SecurityPolicy update(@NonNull UpdatePolicyCommand command, UUID actorUserId) {
        validate(command);

        AdminPolicy policy = adminPolicyRepository.findCurrent()
                .orElseGet(() -> {
                    AdminPolicy created = new AdminPolicy();
                    created.setId(AdminPolicy.SINGLETON_ID);
                    return created;
                });

        policy.setDualApprovalRequired(command.dualApprovalRequired());
        policy.setBreakGlassEnabled(command.breakGlassEnabled());
        policy.setBreakGlassMinReasonLength(command.breakGlassMinReasonLength());
        policy.setStepUpTtlSeconds(command.stepUpTtlSeconds());
        policy.setStepUpSingleUse(command.stepUpSingleUse());
        policy.setApprovalExpiryMinutes(command.approvalExpiryMinutes());
        policy.setUpdatedBy(actorUserId);

        SecurityPolicy saved = SecurityPolicy.from(adminPolicyRepository.save(policy));
        log.info("security policy updated by={} dualApproval={} breakGlass={} minReason={} stepUpTtl={}s singleUse={} approvalExpiry={}m",
                actorUserId, saved.dualApprovalRequired(), saved.breakGlassEnabled(), saved.breakGlassMinReasonLength(),
                saved.stepUpTtlSeconds(), saved.stepUpSingleUse(), saved.approvalExpiryMinutes());
        return saved;
    }

    private void validate(UpdatePolicyCommand command) {
        if (command.breakGlassMinReasonLength() < 1) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCodes.VALIDATION_ERROR,
                    "breakGlassMinReasonLength must be at least 1");
        }
        if (command.stepUpTtlSeconds() < SecurityPolicy.MIN_STEP_UP_TTL_SECONDS) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCodes.VALIDATION_ERROR,
                    "stepUpTtlSeconds must be at least " + SecurityPolicy.MIN_STEP_UP_TTL_SECONDS);
        }
        if (command.approvalExpiryMinutes() < SecurityPolicy.MIN_APPROVAL_EXPIRY_MINUTES) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCodes.VALIDATION_ERROR,
                    "approvalExpiryMinutes must be at least " + SecurityPolicy.MIN_APPROVAL_EXPIRY_MINUTES);
        }
    }

    public record UpdatePolicyCommand(
            boolean dualApprovalRequired,
            boolean breakGlassEnabled,
            int breakGlassMinReasonLength,
            int stepUpTtlSeconds,
            boolean stepUpSingleUse,
            int approvalExpiryMinutes
    ) {
    }
}
