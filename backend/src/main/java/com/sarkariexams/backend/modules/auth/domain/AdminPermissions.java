package com.sarkariexams.backend.modules.auth.domain;

import java.util.List;

public final class AdminPermissions {

    public static final String ADMIN_READ = "admin:read";
    public static final String ADMIN_WRITE = "admin:write";
    public static final String ANALYTICS_READ = "analytics:read";
    public static final String ANNOUNCEMENTS_READ = "announcements:read";
    public static final String ANNOUNCEMENTS_WRITE = "announcements:write";
    public static final String ANNOUNCEMENTS_APPROVE = "announcements:approve";
    public static final String ANNOUNCEMENTS_DELETE = "announcements:delete";
    public static final String AUDIT_READ = "audit:read";
    public static final String SECURITY_READ = "security:read";

    public static final List<String> ALL = List.of(
            ADMIN_READ,
            ADMIN_WRITE,
            ANALYTICS_READ,
            ANNOUNCEMENTS_READ,
            ANNOUNCEMENTS_WRITE,
            ANNOUNCEMENTS_APPROVE,
            ANNOUNCEMENTS_DELETE,
            AUDIT_READ,
            SECURITY_READ
    );

    private AdminPermissions() {
    }
}
