package com.sarkariexams.backend.modules.announcement.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sarkariexams.backend.global.common.crypto.TokenDigests;
import com.sarkariexams.backend.global.error.ErrorCodes;
import com.sarkariexams.backend.global.error.ProblemException;
import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.modules.admin.application.GuardedExecution;
import com.sarkariexams.backend.modules.announcement.domain.Announcement;
import com.sarkariexams.backend.modules.announcement.domain.AnnouncementStatus;
import com.sarkariexams.backend.modules.announcement.domain.AnnouncementVersion;
import com.sarkariexams.backend.modules.announcement.infrastructure.AnnouncementRepository;
import com.sarkariexams.backend.modules.announcement.infrastructure.AnnouncementVersionRepository;
import com.sarkariexams.backend.modules.announcement.presentation.dto.AnnouncementResponse;
import com.sarkariexams.backend.modules.announcement.presentation.dto.AnnouncementVersionResponse;
import com.sarkariexams.backend.modules.announcement.presentation.dto.DeletedAnnouncementResponse;
import com.sarkariexams.backend.modules.announcement.presentation.dto.RollbackPreviewResponse;
import com.sarkariexams.backend.modules.audit.application.AuditLogService;
import com.sarkariexams.backend.modules.audit.application.AuditLogService.AuditEntry;
import com.sarkariexams.backend.modules.auth.domain.AdminPermissions;
import com.sarkariexams.backend.modules.auth.domain.AdminRole;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Announcement edits behind the admin portal. Mutating methods run inside the guard's
 * transaction and write their audit entry there, so the change and its record commit together.
 */
@Service
@Transactional
public class AnnouncementAdminService {

    private static final Logger log = LoggerFactory.getLogger(AnnouncementAdminService.class);
    private static final String RESOURCE_TYPE = "announcement";

    private final AnnouncementRepository announcementRepository;
    private final AnnouncementVersionRepository announcementVersionRepository;
    private final AuditLogService auditLogService;
    private final ObjectMapper canonicalMapper;
    private final Clock clock;

    public AnnouncementAdminService(
            AnnouncementRepository announcementRepository,
            AnnouncementVersionRepository announcementVersionRepository,
            AuditLogService auditLogService,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.announcementRepository = announcementRepository;
        this.announcementVersionRepository = announcementVersionRepository;
        this.auditLogService = auditLogService;
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public AnnouncementResponse get(UUID id) {
        return AnnouncementResponse.from(require(id));
    }

    @Transactional(readOnly = true)
    public AnnouncementStatus currentStatus(UUID id) {
        return require(id).getStatus();
    }

    @Transactional(readOnly = true)
    public List<AnnouncementVersionResponse> versions(UUID id) {
        require(id);
        return announcementVersionRepository.findByAnnouncementIdOrderByVersionDesc(id).stream()
                .map(AnnouncementVersionResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public AnnouncementStatus snapshotStatus(UUID id, int version) {
        return AnnouncementChanges.fromPayload(requireVersion(id, version).getSnapshot()).status();
    }

    /**
     * Role rules for saving: contributors keep drafts, editors may also submit for review, and
     * only holders of {@code announcements:approve} may publish or schedule.
     */
    public void assertCanSave(ActorContext actor, AnnouncementStatus resultingStatus, AnnouncementStatus requestedStatus) {
        if (actor.role() == AdminRole.CONTRIBUTOR && resultingStatus != AnnouncementStatus.DRAFT) {
            throw forbidden("Contributors can only save drafts");
        }
        if (actor.role() == AdminRole.EDITOR
                && resultingStatus != AnnouncementStatus.DRAFT
                && resultingStatus != AnnouncementStatus.PENDING) {
            throw forbidden("Editors can only save draft or pending announcements");
        }
        if (requestedStatus != null && requestedStatus.goesLive()
                && !actor.hasPermission(AdminPermissions.ANNOUNCEMENTS_APPROVE)) {
            throw forbidden("Publishing requires announcements:approve");
        }
    }

    /**
     * Checks run before an announcement write is executed or queued, so a reviewer never signs
     * off a change that would fail when the requester replays it. Returns the current status.
     */
    @Transactional(readOnly = true)
    public AnnouncementStatus checkUpdate(UUID id, AnnouncementChanges changes) {
        Announcement announcement = require(id);
        AnnouncementStatus resulting = changes.status() == null ? announcement.getStatus() : changes.status();
        requirePublishable(resulting,
                changes.content() != null ? changes.content() : announcement.getContent(),
                changes.externalLink() != null ? changes.externalLink() : announcement.getExternalLink());
        return announcement.getStatus();
    }

    public void checkCreate(AnnouncementChanges changes) {
        if (changes.status() != null) {
            requirePublishable(changes.status(), changes.content(), changes.externalLink());
        }
    }

    @Transactional(readOnly = true)
    public void checkApprove(UUID id) {
        Announcement announcement = require(id);
        requireNotPublished(announcement);
        requirePublishable(AnnouncementStatus.PUBLISHED, announcement.getContent(), announcement.getExternalLink());
    }

    /**
     * Approval target for an announcement that does not exist yet: the same body always maps to
     * the same key, so a replay with the approval id finds its request.
     */
    public String newAnnouncementTargetKey(Map<String, Object> payload) {
        try {
            return "new:" + TokenDigests.sha256Hex(canonicalMapper.writeValueAsString(payload));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("announcement payload is not serializable", ex);
        }
    }

    public AnnouncementResponse create(AnnouncementChanges changes, String note, GuardedExecution execution) {
        requireText(changes.title(), "title");
        requireText(changes.type(), "type");
        requireText(changes.category(), "category");
        requireText(changes.organization(), "organization");

        Announcement announcement = new Announcement();
        announcement.setTitle(changes.title().trim());
        announcement.setType(changes.type().trim());
        announcement.setCategory(changes.category().trim());
        announcement.setOrganization(changes.organization().trim());
        announcement.setContent(changes.content());
        announcement.setExternalLink(changes.externalLink());
        announcement.setPublishAt(changes.publishAt());
        AnnouncementStatus status = changes.status() == null ? AnnouncementStatus.DRAFT : changes.status();
        announcement.setStatus(status);
        if (status == AnnouncementStatus.PUBLISHED) {
            markPublished(announcement, approverOf(execution));
        }
        validateForPublish(announcement);

        Announcement saved = announcementRepository.save(announcement);
        saveVersion(saved, note);
        audit("create", saved.getId(), execution, note, Map.of("status", status.code()));
        log.info("announcement created id={} status={} by={}", saved.getId(), status.code(), execution.actor().userId());
        return AnnouncementResponse.from(saved);
    }

    public AnnouncementResponse update(UUID id, AnnouncementChanges changes, String note, GuardedExecution execution) {
        Announcement announcement = requireForUpdate(id);
        AnnouncementStatus previous = announcement.getStatus();

        if (changes.title() != null) {
            requireText(changes.title(), "title");
            announcement.setTitle(changes.title().trim());
        }
        if (changes.type() != null) {
            announcement.setType(changes.type().trim());
        }
        if (changes.category() != null) {
            announcement.setCategory(changes.category().trim());
        }
        if (changes.organization() != null) {
            announcement.setOrganization(changes.organization().trim());
        }
        if (changes.content() != null) {
            announcement.setContent(changes.content());
        }
        if (changes.externalLink() != null) {
            announcement.setExternalLink(changes.externalLink());
        }
        if (changes.publishAt() != null) {
            announcement.setPublishAt(changes.publishAt());
        }
        if (changes.status() != null) {
            announcement.setStatus(changes.status());
            if (changes.status() == AnnouncementStatus.PUBLISHED && previous != AnnouncementStatus.PUBLISHED) {
                markPublished(announcement, approverOf(execution));
            } else if (previous == AnnouncementStatus.PUBLISHED && changes.status() != AnnouncementStatus.PUBLISHED) {
                announcement.setApprovedAt(null);
                announcement.setApprovedBy(null);
            }
        }
        validateForPublish(announcement);

        saveVersion(announcement, note);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fields", changes.toPayload().keySet().stream().sorted().toList());
        details.put("previousStatus", previous.code());
        details.put("newStatus", announcement.getStatus().code());
        audit(updateAuditAction(previous, changes.status()), id, execution, note, details);
        return AnnouncementResponse.from(announcement);
    }

    public AnnouncementResponse approve(UUID id, String note, GuardedExecution execution) {
        Announcement announcement = requireForUpdate(id);
        requireNotPublished(announcement);
        announcement.setStatus(AnnouncementStatus.PUBLISHED);
        markPublished(announcement, approverOf(execution));
        announcement.setPublishAt(announcement.getApprovedAt());
        validateForPublish(announcement);

        saveVersion(announcement, note);
        audit("approve", id, execution, note, Map.of());
        return AnnouncementResponse.from(announcement);
    }

    public AnnouncementResponse reject(UUID id, String note, GuardedExecution execution) {
        Announcement announcement = requireForUpdate(id);
        AnnouncementStatus previous = announcement.getStatus();
        announcement.setStatus(AnnouncementStatus.DRAFT);
        announcement.setApprovedAt(null);
        announcement.setApprovedBy(null);

        saveVersion(announcement, note);
        audit(previous == AnnouncementStatus.PUBLISHED ? "unpublish" : "reject", id, execution, note,
                Map.of("previousStatus", previous.code()));
        return AnnouncementResponse.from(announcement);
    }

    @Transactional(readOnly = true)
    public RollbackPreviewResponse previewRollback(UUID id, int version) {
        Announcement announcement = require(id);
        AnnouncementVersion target = requireVersion(id, version);
        AnnouncementStatus snapshotStatus = AnnouncementChanges.fromPayload(target.getSnapshot()).status();
        return new RollbackPreviewResponse(true, version, announcement.getRevision(),
                snapshotStatus == null ? null : snapshotStatus.code(), target.getSnapshot());
    }

    public AnnouncementResponse rollback(UUID id, int version, String note, GuardedExecution execution) {
        Announcement announcement = requireForUpdate(id);
        Map<String, Object> snapshot = requireVersion(id, version).getSnapshot();
        AnnouncementChanges restored = AnnouncementChanges.fromPayload(snapshot);

        announcement.setTitle(restored.title());
        announcement.setType(restored.type());
        announcement.setCategory(restored.category());
        announcement.setOrganization(restored.organization());
        announcement.setContent(restored.content());
        announcement.setExternalLink(restored.externalLink());
        announcement.setStatus(restored.status());
        announcement.setPublishAt(restored.publishAt());
        announcement.setApprovedAt(parseTimestamp(snapshot.get("approvedAt")));
        announcement.setApprovedBy(parseUuid(snapshot.get("approvedBy")));

        saveVersion(announcement, note == null ? "Rolled back to version " + version : note);
        audit("rollback", id, execution, note, Map.of("targetVersion", version));
        return AnnouncementResponse.from(announcement);
    }

    public DeletedAnnouncementResponse delete(UUID id, GuardedExecution execution) {
        Announcement announcement = requireForUpdate(id);
        announcementVersionRepository.deleteByAnnouncementId(id);
        announcementRepository.delete(announcement);
        audit("delete", id, execution, null, Map.of("title", announcement.getTitle()));
        log.info("announcement deleted id={} by={}", id, execution.actor().userId());
        return DeletedAnnouncementResponse.of(id);
    }

    // The second reviewer signs off a queued publish; otherwise the actor does.
    private static UUID approverOf(GuardedExecution execution) {
        if (execution.approval() != null && execution.approval().getReviewerUserId() != null) {
            return execution.approval().getReviewerUserId();
        }
        return execution.actor().userId();
    }

    private void markPublished(Announcement announcement, UUID approver) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (announcement.getPublishAt() == null) {
            announcement.setPublishAt(now);
        }
        announcement.setApprovedAt(now);
        announcement.setApprovedBy(approver);
    }

    private void saveVersion(Announcement announcement, String note) {
        int revision = announcement.nextRevision();
        Announcement saved = announcementRepository.save(announcement);
        announcementVersionRepository.save(new AnnouncementVersion(saved.getId(), revision, saved.snapshot(), note));
    }

    private void audit(String action, UUID announcementId, GuardedExecution execution, String note,
                       Map<String, Object> details) {
        auditLogService.record(new AuditEntry(
                action,
                RESOURCE_TYPE,
                announcementId.toString(),
                announcementId,
                execution.actor().userId(),
                note,
                execution.auditMetadataWith(details)
        ));
    }

    private static String updateAuditAction(AnnouncementStatus previous, AnnouncementStatus requested) {
        if (requested == null || requested == previous) {
            return "update";
        }
        if (requested == AnnouncementStatus.PENDING) {
            return "submit_review";
        }
        if (previous == AnnouncementStatus.PUBLISHED) {
            return "unpublish";
        }
        if (requested == AnnouncementStatus.PUBLISHED) {
            return "publish";
        }
        return "update";
    }

    private static void validateForPublish(Announcement announcement) {
        requirePublishable(announcement.getStatus(), announcement.getContent(), announcement.getExternalLink());
    }

    private static void requireNotPublished(Announcement announcement) {
        if (announcement.getStatus() == AnnouncementStatus.PUBLISHED) {
            throw new ProblemException(HttpStatus.CONFLICT, ErrorCodes.INVALID_STATUS_TRANSITION,
                    "Announcement is already published");
        }
    }

    private static void requirePublishable(AnnouncementStatus status, String content, String externalLink) {
        if (!status.goesLive()) {
            return;
        }
        boolean hasBody = content != null && !content.isBlank();
        boolean hasLink = externalLink != null && !externalLink.isBlank();
        if (!hasBody && !hasLink) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCodes.VALIDATION_ERROR,
                    "Published announcements need content or an external link");
        }
    }

    private Announcement require(UUID id) {
        return announcementRepository.findById(id).orElseThrow(AnnouncementAdminService::notFound);
    }

    private Announcement requireForUpdate(UUID id) {
        return announcementRepository.findForUpdate(id).orElseThrow(AnnouncementAdminService::notFound);
    }

    private AnnouncementVersion requireVersion(UUID id, int version) {
        return announcementVersionRepository.findByAnnouncementIdAndVersion(id, version)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, ErrorCodes.NOT_FOUND,
                        "Version snapshot not found"));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ErrorCodes.VALIDATION_ERROR,
                    field + " is required");
        }
    }

    private static OffsetDateTime parseTimestamp(Object raw) {
        return raw == null ? null : OffsetDateTime.parse(raw.toString());
    }

    private static UUID parseUuid(Object raw) {
        return raw == null ? null : UUID.fromString(raw.toString());
    }

    private static ProblemException notFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, ErrorCodes.NOT_FOUND, "Announcement not found");
    }

    private static ProblemException forbidden(String detail) {
        return new ProblemException(HttpStatus.FORBIDDEN, ErrorCodes.FORBIDDEN, detail);
    }
}
