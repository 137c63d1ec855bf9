package com.sarkariexams.backend.modules.approval.infrastructure;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.sarkariexams.backend.modules.approval.domain.ApprovalRequest;
import com.sarkariexams.backend.modules.approval.domain.ApprovalStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Every status transition is a single conditional statement so concurrent callers race on the
 * database row, not on an in-memory read.
 */
public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequest, UUID> {

    /**
     * Inserts a pending request unless one is already pending for the same target and action
     * class. Backed by the partial unique index {@code ux_approval_request_pending}; returns 0 on
     * conflict without aborting the surrounding transaction.
     */
    @Modifying
    @Query(value = """
            insert into approval_request (
                id, action_type, action_class, target_key, requester_user_id, status,
                payload, http_method, endpoint, note, created_at, expires_at
            ) values (
                :id, :actionType, :actionClass, :targetKey, :requesterUserId, 'PENDING',
                cast(:payload as jsonb), :method, :endpoint, :note, :createdAt, :expiresAt
            )
            on conflict (target_key, action_class) where status = 'PENDING' do nothing
            """, nativeQuery = true)
    int insertPendingIfAbsent(@Param("id") UUID id,
                              @Param("actionType") String actionType,
                              @Param("actionClass") String actionClass,
                              @Param("targetKey") String targetKey,
                              @Param("requesterUserId") UUID requesterUserId,
                              @Param("payload") String payloadJson,
                              @Param("method") String method,
                              @Param("endpoint") String endpoint,
                              @Param("note") String note,
                              @Param("createdAt") OffsetDateTime createdAt,
                              @Param("expiresAt") OffsetDateTime expiresAt);

    @Query("""
            select ar
              from ApprovalRequest ar
             where ar.targetKey = :targetKey
               and ar.actionClass = :actionClass
               and ar.status = com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.PENDING
            """)
    Optional<ApprovalRequest> findPending(@Param("targetKey") String targetKey,
                                          @Param("actionClass") String actionClass);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update ApprovalRequest ar
               set ar.status = com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.EXPIRED
             where ar.targetKey = :targetKey
               and ar.actionClass = :actionClass
               and ar.status = com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.PENDING
               and ar.expiresAt <= :now
            """)
    int expireStaleForTarget(@Param("targetKey") String targetKey,
                             @Param("actionClass") String actionClass,
                             @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update ApprovalRequest ar
               set ar.status = com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.EXPIRED
             where ar.status = com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.PENDING
               and ar.expiresAt <= :now
            """)
    int expireStale(@Param("now") OffsetDateTime now);

    /**
     * Compare-and-set from pending to {@code decided}. Refuses expired rows and self-review.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update ApprovalRequest ar
               set ar.status = :decided,
                   ar.reviewerUserId = :reviewerUserId,
                   ar.reviewNote = :reviewNote,
                   ar.decidedAt = :now
             where ar.id = :id
               and ar.status = com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.PENDING
               and ar.expiresAt > :now
               and ar.requesterUserId <> :reviewerUserId
            """)
    int decide(@Param("id") UUID id,
               @Param("decided") ApprovalStatus decided,
               @Param("reviewerUserId") UUID reviewerUserId,
               @Param("reviewNote") String reviewNote,
               @Param("now") OffsetDateTime now);

    /**
     * Compare-and-set from approved to executed. Only one caller can win; the row lock is held
     * until that caller's transaction ends.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update ApprovalRequest ar
               set ar.status = com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.EXECUTED,
                   ar.executedByUserId = :executorUserId,
                   ar.executedAt = :now
             where ar.id = :id
               and ar.status = com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.APPROVED
            """)
    int claimForExecution(@Param("id") UUID id,
                          @Param("executorUserId") UUID executorUserId,
                          @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            update approval_request
               set result = cast(:result as jsonb)
             where id = :id
               and status = 'EXECUTED'
            """, nativeQuery = true)
    int storeResult(@Param("id") UUID id, @Param("result") String resultJson);

    @Query("""
            select ar
              from ApprovalRequest ar
             where (:status is null or ar.status = :status)
             order by ar.createdAt desc
            """)
    Page<ApprovalRequest> search(@Param("status") ApprovalStatus status, Pageable pageable);

    /**
     * Retention cleanup. Approved requests the requester never replayed age out with the closed
     * ones; pending rows are expired by the sweep before they can match.
     */
    @Modifying
    @Query("""
            delete from ApprovalRequest ar
             where ar.status in (
                    com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.APPROVED,
                    com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.REJECTED,
                    com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.EXPIRED,
                    com.sarkariexams.backend.modules.approval.domain.ApprovalStatus.EXECUTED
               )
               and ar.createdAt < :cutoff
            """)
    int deleteInactiveBefore(@Param("cutoff") OffsetDateTime cutoff);
}
