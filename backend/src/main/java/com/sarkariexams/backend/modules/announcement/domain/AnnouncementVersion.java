package com.sarkariexams.backend.modules.announcement.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;
import org.springframework.data.annotation.CreatedBy;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

@Entity
@Table(name = "announcement_version")
@EntityListeners(AuditingEntityListener.class)
public class AnnouncementVersion {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "announcement_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID announcementId;

    @Column(name = "version", nullable = false, updatable = false)
    private int version;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "snapshot", nullable = false, columnDefinition = "jsonb")
    private Map<String, Object> snapshot;

    @Column(name = "note", length = 1000)
    private String note;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @CreatedBy
    @Column(name = "created_by", columnDefinition = "uuid", updatable = false)
    private UUID createdBy;

    protected AnnouncementVersion() {
    }

    public AnnouncementVersion(UUID announcementId, int version, Map<String, Object> snapshot, String note) {
        this.announcementId = announcementId;
        this.version = version;
        this.snapshot = snapshot;
        this.note = note;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAnnouncementId() {
        return announcementId;
    }

    public int getVersion() {
        return version;
    }

    public Map<String, Object> getSnapshot() {
        return snapshot;
    }

    public String getNote() {
        return note;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }
}
