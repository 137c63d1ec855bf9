package com.sarkariexams.backend.modules.announcement.presentation.dto;

import java.time.OffsetDateTime;

import com.sarkariexams.backend.modules.announcement.application.AnnouncementChanges;

import jakarta.validation.constraints.Size;

public record UpdateAnnouncementRequest(
        @Size(max = 300) String title,
        @Size(max = 32) String type,
        @Size(max = 120) String category,
        @Size(max = 200) String organization,
        String content,
        @Size(max = 1000) String externalLink,
        String status,
        OffsetDateTime publishAt,
        @Size(max = 1000) String note
) {

    public AnnouncementChanges toChanges() {
        return new AnnouncementChanges(title, type, category, organization, content, externalLink,
                AnnouncementChanges.status(status), publishAt);
    }
}
