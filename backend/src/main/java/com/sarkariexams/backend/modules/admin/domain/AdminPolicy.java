package com.sarkariexams.backend.modules.admin.domain;

import java.util.UUID;

import com.sarkariexams.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "admin_policy")
public class AdminPolicy extends AbstractTimestampedEntity {

    public static final UUID SINGLETON_ID = UUID.fromString("00000000-0000-0000-0000-00000000a001");

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "dual_approval_required", nullable = false)
    private boolean dualApprovalRequired;

    @Column(name = "break_glass_enabled", nullable = false)
    private boolean breakGlassEnabled;

    @Column(name = "break_glass_min_reason_length", nullable = false)
    private int breakGlassMinReasonLength;

    @Column(name = "step_up_ttl_seconds", nullable = false)
    private int stepUpTtlSeconds;

    @Column(name = "step_up_single_use", nullable = false)
    private boolean stepUpSingleUse;

    @Column(name = "approval_expiry_minutes", nullable = false)
    private int approvalExpiryMinutes;

    @Column(name = "updated_by", columnDefinition = "uuid")
    private UUID updatedBy;

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public boolean isDualApprovalRequired() {
        return dualApprovalRequired;
    }

    public void setDualApprovalRequired(boolean dualApprovalRequired) {
        this.dualApprovalRequired = dualApprovalRequired;
    }

    public boolean isBreakGlassEnabled() {
        return breakGlassEnabled;
    }

    public void setBreakGlassEnabled(boolean breakGlassEnabled) {
        this.breakGlassEnabled = breakGlassEnabled;
    }

    public int getBreakGlassMinReasonLength() {
        return breakGlassMinReasonLength;
    }

    public void setBreakGlassMinReasonLength(int breakGlassMinReasonLength) {
        this.breakGlassMinReasonLength = breakGlassMinReasonLength;
    }

    public int getStepUpTtlSeconds() {
        return stepUpTtlSeconds;
    }

    public void setStepUpTtlSeconds(int stepUpTtlSeconds) {
        this.stepUpTtlSeconds = stepUpTtlSeconds;
    }

    public boolean isStepUpSingleUse() {
        return stepUpSingleUse;
    }

    public void setStepUpSingleUse(boolean stepUpSingleUse) {
        this.stepUpSingleUse = stepUpSingleUse;
    }

    public int getApprovalExpiryMinutes() {
        return approvalExpiryMinutes;
    }

    public void setApprovalExpiryMinutes(int approvalExpiryMinutes) {
        this.approvalExpiryMinutes = approvalExpiryMinutes;
    }

    public UUID getUpdatedBy() {
        return updatedBy;
    }

    public void setUpdatedBy(UUID updatedBy) {
        this.updatedBy = updatedBy;
    }
}
