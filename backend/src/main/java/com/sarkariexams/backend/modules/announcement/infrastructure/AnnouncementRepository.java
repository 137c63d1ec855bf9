package com.sarkariexams.backend.modules.announcement.infrastructure;

import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.modules.announcement.domain.Announcement;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AnnouncementRepository extends JpaRepository<Announcement, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Announcement a where a.id = :id")
    Optional<Announcement> findForUpdate(@Param("id") UUID id);
}
