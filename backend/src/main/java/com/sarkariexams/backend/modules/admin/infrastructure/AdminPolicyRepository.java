package com.sarkariexams.backend.modules.admin.infrastructure;

import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.modules.admin.domain.AdminPolicy;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AdminPolicyRepository extends JpaRepository<AdminPolicy, UUID> {

    default Optional<AdminPolicy> findCurrent() {
        return findById(AdminPolicy.SINGLETON_ID);
    }
}
