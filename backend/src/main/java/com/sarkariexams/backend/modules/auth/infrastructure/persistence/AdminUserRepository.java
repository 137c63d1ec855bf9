package com.sarkariexams.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.modules.auth.domain.AdminUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AdminUserRepository extends JpaRepository<AdminUser, UUID> {

    @Query("select au from AdminUser au where lower(au.email) = lower(:email)")
    Optional<AdminUser> findByEmailIgnoreCase(@Param("email") String email);
}
