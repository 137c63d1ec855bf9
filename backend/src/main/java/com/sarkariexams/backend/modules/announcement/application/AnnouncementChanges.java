package com.sarkariexams.backend.modules.announcement.application;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.modules.announcement.domain.AnnouncementStatus;

import org.springframework.http.HttpStatus;

/**
 * Field changes for an announcement; {@code null} means "leave as is". Converts to and from the
 * plain map stored on approval requests so a queued edit can be applied later.
 */
public record AnnouncementChanges(
        String title,
        String type,
        String category,
        String organization,
        String content,
        String externalLink,
        AnnouncementStatus status,
        OffsetDateTime publishAt
) {

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        putIfPresent(payload, "title", title);
        putIfPresent(payload, "type", type);
        putIfPresent(payload, "category", category);
        putIfPresent(payload, "organization", organization);
        putIfPresent(payload, "content", content);
        putIfPresent(payload, "externalLink", externalLink);
        putIfPresent(payload, "status", status == null ? null : status.code());
        putIfPresent(payload, "publishAt", publishAt == null ? null : publishAt.toString());
        return payload;
    }

    public static AnnouncementChanges fromPayload(Map<String, Object> payload) {
        return new AnnouncementChanges(
                text(payload, "title"),
                text(payload, "type"),
                text(payload, "category"),
                text(payload, "organization"),
                text(payload, "content"),
                text(payload, "externalLink"),
                status(text(payload, "status")),
                timestamp(text(payload, "publishAt"))
        );
    }

    public static AnnouncementStatus status(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return AnnouncementStatus.fromCode(raw);
        } catch (IllegalArgumentException ex) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCodes.VALIDATION_ERROR,
                    "Unknown announcement status: " + raw);
        }
    }

    private static OffsetDateTime timestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw);
        } catch (DateTimeParseException ex) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCodes.VALIDATION_ERROR,
                    "publishAt must be an ISO-8601 timestamp");
        }
    }

    private static String text(Map<String, Object> payload, String key) {
        Object value = payload == null ? null : payload.get(key);
        return value == null ? null : value.toString();
    }

    private static void putIfPresent(Map<String, Object> payload, String key, Object value) {
        if (value != null) {
            payload.put(key, value);
        }
    }
}
