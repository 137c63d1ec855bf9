package com.sarkariexams.backend.modules.admin.application;

import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;

public record GuardedResult<T>(Status status, T data, ApprovalRequest approval, boolean replayed) {

    public enum Status {
        EXECUTED,
        QUEUED
    }

    public static <T> GuardedResult<T> executed(T data, ApprovalRequest approval, boolean replayed) {
        return new GuardedResult<>(Status.EXECUTED, data, approval, replayed);
    }

    public static <T> GuardedResult<T> queued(ApprovalRequest approval) {
        return new GuardedResult<>(Status.QUEUED, null, approval, false);
    }

    public boolean isQueued() {
        return status == Status.QUEUED;
    }
}
