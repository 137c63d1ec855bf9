package com.sarkariexams.backend.modules.approval.domain;

public enum ApprovalOutcome {
    APPROVE(ApprovalStatus.APPROVED),
    REJECT(ApprovalStatus.REJECTED);

    private final ApprovalStatus resultingStatus;

    ApprovalOutcome(ApprovalStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public ApprovalStatus resultingStatus() {
        return resultingStatus;
    }
}
