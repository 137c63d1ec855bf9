package com.sarkariexams.backend.modules.announcement.infrastructure;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.modules.announcement.domain.AnnouncementVersion;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AnnouncementVersionRepository extends JpaRepository<AnnouncementVersion, UUID> {

    Optional<AnnouncementVersion> findByAnnouncementIdAndVersion(UUID announcementId, int version);

    List<AnnouncementVersion> findByAnnouncementIdOrderByVersionDesc(UUID announcementId);

    @Modifying
    @Query("delete from AnnouncementVersion v where v.announcementId = :announcementId")
    int deleteByAnnouncementId(@Param("announcementId") UUID announcementId);
}
