package com.sarkariexams.backend.modules.approval.domain;

import java.util.Locale;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    EXPIRED,
    EXECUTED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ApprovalStatus fromCode(String raw) {
        return ApprovalStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
