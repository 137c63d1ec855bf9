package com.sarkariexams.backend.modules.announcement.domain;

import java.util.Locale;

public enum AnnouncementStatus {
    DRAFT,
    PENDING,
    SCHEDULED,
    PUBLISHED,
    ARCHIVED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean goesLive() {
        return this == PUBLISHED || this == SCHEDULED;
    }

    public static AnnouncementStatus fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        return AnnouncementStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
