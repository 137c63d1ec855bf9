package com.sarkariexams.backend.modules.auth.domain;

public enum AdminUserStatus {
    ACTIVE,
    DISABLED
}
