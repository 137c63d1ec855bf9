package com.sarkariexams.backend.modules.announcement.presentation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.sarkariexams.backend.global.security.ActorContext;
import com.sarkariexams.backend.global.security.SecurityUtils;
import com.sarkariexams.backend.global.web.DataResponse;
import com.sarkariexams.backend.modules.admin.application.AdminActionGuard;
import com.sarkariexams.backend.modules.admin.application.GuardedResult;
import com.sarkariexams.backend.modules.admin.domain.GuardedAction;
import com.sarkariexams.backend.modules.admin.domain.RequestIntent;
import com.sarkariexams.backend.modules.admin.presentation.GuardedRequests;
import com.sarkariexams.backend.modules.announcement.application.AnnouncementAdminService;
import com.sarkariexams.backend.modules.announcement.application.AnnouncementChanges;
import com.sarkariexams.backend.modules.announcement.domain.AnnouncementStatus;
import com.sarkariexams.backend.modules.announcement.presentation.dto.AnnouncementNoteRequest;
import com.sarkariexams.backend.modules.announcement.presentation.dto.AnnouncementResponse;
import com.sarkariexams.backend.modules.announcement.presentation.dto.AnnouncementVersionResponse;
import com.sarkariexams.backend.modules.announcement.presentation.dto.CreateAnnouncementRequest;
import com.sarkariexams.backend.modules.announcement.presentation.dto.DeletedAnnouncementResponse;
import com.sarkariexams.backend.modules.announcement.presentation.dto.RollbackPreviewResponse;
import com.sarkariexams.backend.modules.announcement.presentation.dto.RollbackRequest;
import com.sarkariexams.backend.modules.announcement.presentation.dto.UpdateAnnouncementRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Announcement writes. Which guarded action applies depends on the status the announcement is
 * in or is moving to; the guard then decides between running now, queueing for a second
 * reviewer and refusing.
 */
@RestController
@RequestMapping("/admin/announcements")
@Tag(name = "Announcements", description = "Announcement editing and publishing")
public class AnnouncementAdminController {

    private static final String NOTE_KEY = "note";
    private static final String VERSION_KEY = "version";

    private final AnnouncementAdminService announcementAdminService;
    private final AdminActionGuard adminActionGuard;

    public AnnouncementAdminController(AnnouncementAdminService announcementAdminService,
                                       AdminActionGuard adminActionGuard) {
        this.announcementAdminService = announcementAdminService;
        this.adminActionGuard = adminActionGuard;
    }

    @GetMapping("/{id}")
    @Operation(summary = "Read one announcement")
    public ResponseEntity<DataResponse<AnnouncementResponse>> get(@PathVariable UUID id) {
        return ResponseEntity.ok(DataResponse.of(announcementAdminService.get(id)));
    }

    @GetMapping("/{id}/versions")
    @Operation(summary = "Version history, newest first")
    public ResponseEntity<DataResponse<List<AnnouncementVersionResponse>>> versions(@PathVariable UUID id) {
        return ResponseEntity.ok(DataResponse.of(announcementAdminService.versions(id)));
    }

    @PostMapping
    @Operation(summary = "Create an announcement",
            description = "Creating with status published needs step-up and, while dual approval is on, a second reviewer")
    public ResponseEntity<?> create(@Valid @RequestBody CreateAnnouncementRequest request, HttpServletRequest http) {
        ActorContext actor = SecurityUtils.currentActor();
        AnnouncementChanges changes = request.toChanges();
        AnnouncementStatus resulting = changes.status() == null ? AnnouncementStatus.DRAFT : changes.status();
        announcementAdminService.assertCanSave(actor, resulting, changes.status());
        announcementAdminService.checkCreate(changes);

        Map<String, Object> payload = withNote(changes.toPayload(), request.note());
        boolean publishing = resulting == AnnouncementStatus.PUBLISHED;
        GuardedAction action = publishing ? GuardedAction.CREATE_PUBLISH : GuardedAction.CREATE_DRAFT;
        String targetKey = publishing ? announcementAdminService.newAnnouncementTargetKey(payload) : "new";

        GuardedResult<AnnouncementResponse> result = adminActionGuard.run(
                GuardedRequests.gateRequest(http, actor, action, targetKey, null, payload, request.note()),
                AnnouncementResponse.class,
                execution -> announcementAdminService.create(
                        AnnouncementChanges.fromPayload(execution.payload()), noteOf(execution.payload()), execution)
        );
        return GuardedRequests.toResponse(result, HttpStatus.CREATED);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update an announcement",
            description = "Sensitive when the announcement is or becomes published")
    public ResponseEntity<?> update(
            @PathVariable UUID id,
            @Valid @RequestBody UpdateAnnouncementRequest request,
            HttpServletRequest http
    ) {
        ActorContext actor = SecurityUtils.currentActor();
        AnnouncementChanges changes = request.toChanges();
        AnnouncementStatus existing = announcementAdminService.checkUpdate(id, changes);
        AnnouncementStatus resulting = changes.status() == null ? existing : changes.status();
        announcementAdminService.assertCanSave(actor, resulting, changes.status());

        GuardedAction action = adminActionGuard.actionFor(GuardedRequests.intentOf(http), targetKey(id),
                http.getMethod(), http.getRequestURI(), updateAction(existing, resulting));
        GuardedResult<AnnouncementResponse> result = adminActionGuard.run(
                GuardedRequests.gateRequest(http, actor, action, targetKey(id), id,
                        withNote(changes.toPayload(), request.note()), request.note()),
                AnnouncementResponse.class,
                execution -> announcementAdminService.update(id,
                        AnnouncementChanges.fromPayload(execution.payload()), noteOf(execution.payload()), execution)
        );
        return GuardedRequests.toResponse(result, HttpStatus.OK);
    }

    @PostMapping("/{id}/approve")
    @Operation(summary = "Approve and publish")
    public ResponseEntity<?> approve(
            @PathVariable UUID id,
            @Valid @RequestBody(required = false) AnnouncementNoteRequest request,
            HttpServletRequest http
    ) {
        ActorContext actor = SecurityUtils.currentActor();
        if (GuardedRequests.intentOf(http).kind() == RequestIntent.Kind.WITH_APPROVAL_ID) {
            // an executed approve replays its stored result even though the announcement is now live
            announcementAdminService.currentStatus(id);
        } else {
            announcementAdminService.checkApprove(id);
        }
        String note = request == null ? null : request.trimmedNote();

        GuardedResult<AnnouncementResponse> result = adminActionGuard.run(
                GuardedRequests.gateRequest(http, actor, GuardedAction.APPROVE_ANNOUNCEMENT, targetKey(id), id,
                        withNote(new LinkedHashMap<>(), note), note),
                AnnouncementResponse.class,
                execution -> announcementAdminService.approve(id, noteOf(execution.payload()), execution)
        );
        return GuardedRequests.toResponse(result, HttpStatus.OK);
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Send back to draft",
            description = "Unpublishing a live announcement goes through dual approval")
    public ResponseEntity<?> reject(
            @PathVariable UUID id,
            @Valid @RequestBody(required = false) AnnouncementNoteRequest request,
            HttpServletRequest http
    ) {
        ActorContext actor = SecurityUtils.currentActor();
        AnnouncementStatus existing = announcementAdminService.currentStatus(id);
        String note = request == null ? null : request.trimmedNote();
        GuardedAction action = adminActionGuard.actionFor(GuardedRequests.intentOf(http), targetKey(id),
                http.getMethod(), http.getRequestURI(),
                existing == AnnouncementStatus.PUBLISHED
                        ? GuardedAction.UNPUBLISH_ANNOUNCEMENT
                        : GuardedAction.REJECT_ANNOUNCEMENT);

        GuardedResult<AnnouncementResponse> result = adminActionGuard.run(
                GuardedRequests.gateRequest(http, actor, action, targetKey(id), id,
                        withNote(new LinkedHashMap<>(), note), note),
                AnnouncementResponse.class,
                execution -> announcementAdminService.reject(id, noteOf(execution.payload()), execution)
        );
        return GuardedRequests.toResponse(result, HttpStatus.OK);
    }

    @PostMapping("/{id}/rollback")
    @Operation(summary = "Roll back to a saved version",
            description = "dryRun previews the snapshot; restoring a published snapshot goes through dual approval")
    public ResponseEntity<?> rollback(
            @PathVariable UUID id,
            @Valid @RequestBody RollbackRequest request,
            HttpServletRequest http
    ) {
        ActorContext actor = SecurityUtils.currentActor();
        int version = request.version();
        String note = request.trimmedNote();

        if (request.isDryRun()) {
            GuardedResult<RollbackPreviewResponse> preview = adminActionGuard.run(
                    GuardedRequests.gateRequest(http, actor, GuardedAction.ROLLBACK_ANNOUNCEMENT, targetKey(id), id,
                            Map.of(VERSION_KEY, version, "dryRun", true), note),
                    RollbackPreviewResponse.class,
                    execution -> announcementAdminService.previewRollback(id, version)
            );
            return GuardedRequests.toResponse(preview, HttpStatus.OK);
        }

        GuardedAction action = announcementAdminService.snapshotStatus(id, version) == AnnouncementStatus.PUBLISHED
                ? GuardedAction.ROLLBACK_TO_PUBLISHED
                : GuardedAction.ROLLBACK_ANNOUNCEMENT;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(VERSION_KEY, version);
        GuardedResult<AnnouncementResponse> result = adminActionGuard.run(
                GuardedRequests.gateRequest(http, actor, action, targetKey(id), id, withNote(payload, note), note),
                AnnouncementResponse.class,
                execution -> announcementAdminService.rollback(id,
                        ((Number) execution.payload().get(VERSION_KEY)).intValue(),
                        noteOf(execution.payload()), execution)
        );
        return GuardedRequests.toResponse(result, HttpStatus.OK);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete an announcement", description = "Goes through dual approval")
    public ResponseEntity<?> delete(@PathVariable UUID id, HttpServletRequest http) {
        ActorContext actor = SecurityUtils.currentActor();
        announcementAdminService.currentStatus(id);

        GuardedResult<DeletedAnnouncementResponse> result = adminActionGuard.run(
                GuardedRequests.gateRequest(http, actor, GuardedAction.DELETE_ANNOUNCEMENT, targetKey(id), id,
                        null, null),
                DeletedAnnouncementResponse.class,
                execution -> announcementAdminService.delete(id, execution)
        );
        return GuardedRequests.toResponse(result, HttpStatus.OK);
    }

    // Live announcements stay guarded whether the edit keeps them published or takes them down.
    static GuardedAction updateAction(AnnouncementStatus existing, AnnouncementStatus resulting) {
        if (resulting == AnnouncementStatus.PUBLISHED) {
            return GuardedAction.UPDATE_TO_PUBLISHED;
        }
        if (existing == AnnouncementStatus.PUBLISHED) {
            return GuardedAction.UNPUBLISH_ANNOUNCEMENT;
        }
        return GuardedAction.UPDATE_DRAFT;
    }

    private static String targetKey(UUID id) {
        return "announcement:" + id;
    }

    private static Map<String, Object> withNote(Map<String, Object> payload, String note) {
        if (note != null && !note.isBlank()) {
            payload.put(NOTE_KEY, note.trim());
        }
        return payload;
    }

    private static String noteOf(Map<String, Object> payload) {
        Object note = payload.get(NOTE_KEY);
        return note == null ? null : note.toString();
    }
}
