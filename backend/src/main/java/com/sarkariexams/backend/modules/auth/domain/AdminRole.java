package com.sarkariexams.backend.modules.auth.domain;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Admin portal roles and the permissions each one grants. {@code *} matches everything and
 * {@code prefix:*} matches every permission under that prefix.
 */
public enum AdminRole {

    ADMIN(List.of("*")),
    EDITOR(List.of(
            AdminPermissions.ADMIN_READ,
            AdminPermissions.ADMIN_WRITE,
            AdminPermissions.ANALYTICS_READ,
            AdminPermissions.ANNOUNCEMENTS_READ,
            AdminPermissions.ANNOUNCEMENTS_WRITE
    )),
    CONTRIBUTOR(List.of(
            AdminPermissions.ADMIN_READ,
            AdminPermissions.ANALYTICS_READ,
            AdminPermissions.ANNOUNCEMENTS_READ,
            AdminPermissions.ANNOUNCEMENTS_WRITE
    )),
    REVIEWER(List.of(
            AdminPermissions.ADMIN_READ,
            AdminPermissions.ANALYTICS_READ,
            AdminPermissions.ANNOUNCEMENTS_READ,
            AdminPermissions.ANNOUNCEMENTS_APPROVE,
            AdminPermissions.AUDIT_READ
    )),
    VIEWER(List.of(
            AdminPermissions.ADMIN_READ,
            AdminPermissions.ANALYTICS_READ,
            AdminPermissions.ANNOUNCEMENTS_READ
    ));

    private final List<String> grants;

    AdminRole(List<String> grants) {
        this.grants = grants;
    }

    public boolean hasPermission(String permission) {
        if (permission == null || permission.isBlank()) {
            return false;
        }
        return grants.stream().anyMatch(grant -> matches(permission, grant));
    }

    /**
     * Expands wildcard grants against the known permission catalog.
     */
    public Set<String> effectivePermissions() {
        return AdminPermissions.ALL.stream()
                .filter(this::hasPermission)
                .collect(Collectors.toUnmodifiableSet());
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AdminRole from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        return AdminRole.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    private static boolean matches(String permission, String grant) {
        if ("*".equals(grant)) {
            return true;
        }
        if (grant.endsWith(":*")) {
            return permission.startsWith(grant.substring(0, grant.length() - 1));
        }
        return permission.equals(grant);
    }
}
