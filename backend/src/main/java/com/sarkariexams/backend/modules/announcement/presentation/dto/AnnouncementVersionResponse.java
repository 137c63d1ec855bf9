package com.sarkariexams.backend.modules.announcement.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.sarkariexams.backend.modules.announcement.domain.AnnouncementVersion;

public record AnnouncementVersionResponse(
        int version,
        Map<String, Object> snapshot,
        String note,
        OffsetDateTime createdAt,
        UUID createdBy
) {

    public static AnnouncementVersionResponse from(AnnouncementVersion version) {
        return new AnnouncementVersionResponse(
                version.getVersion(),
                version.getSnapshot(),
                version.getNote(),
                version.getCreatedAt(),
                version.getCreatedBy()
        );
    }
}
