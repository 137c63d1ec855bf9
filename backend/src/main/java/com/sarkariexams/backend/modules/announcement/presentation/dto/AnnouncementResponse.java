package com.sarkariexams.backend.modules.announcement.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.sarkariexams.backend.modules.announcement.domain.Announcement;

public record AnnouncementResponse(
        UUID id,
        String title,
        String type,
        String category,
        String organization,
        String content,
        String externalLink,
        String status,
        OffsetDateTime publishAt,
        OffsetDateTime approvedAt,
        UUID approvedBy,
        int version,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AnnouncementResponse from(Announcement announcement) {
        return new AnnouncementResponse(
                announcement.getId(),
                announcement.getTitle(),
                announcement.getType(),
                announcement.getCategory(),
                announcement.getOrganization(),
                announcement.getContent(),
                announcement.getExternalLink(),
                announcement.getStatus().code(),
                announcement.getPublishAt(),
                announcement.getApprovedAt(),
                announcement.getApprovedBy(),
                announcement.getRevision(),
                announcement.getCreatedAt(),
                announcement.getUpdatedAt()
        );
    }
}
