package com.example.cronhooks.repo;

import com.example.cronhooks.domain.ScheduleKind;
import com.example.cronhooks.domain.WebhookJob;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import javax.persistence.LockModeType;
import java.time.Instant;
import java.util.Optional;

/**
 * Job store. All writes after creation are single-purpose UPDATEs on a few columns, never a full-entity save,
 * so concurrent workers cannot overwrite each other's fields.
 */
@Repository
public interface WebhookJobRepo extends JpaRepository<WebhookJob, Long> {

    /**
     * Row lock for the executor's check-then-act (active flag + success history).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from WebhookJob j where j.id = :id")
    Optional<WebhookJob> findByIdForUpdate(@Param("id") Long id);

    @Query("select j.active from WebhookJob j where j.id = :id")
    Optional<Boolean> findActiveFlag(@Param("id") Long id);

    @Query("select j from WebhookJob j " +
            "where (:tenantId is null or j.tenantId = :tenantId) " +
            "  and (:kind is null or j.scheduleKind = :kind) " +
            "  and (:active is null or j.active = :active)")
    Page<WebhookJob> search(@Param("tenantId") String tenantId,
                            @Param("kind") ScheduleKind kind,
                            @Param("active") Boolean active,
                            Pageable pageable);

    @Modifying
    @Query("update WebhookJob j set j.active = :active where j.id = :id")
    int updateActive(@Param("id") Long id, @Param("active") boolean active);

    @Modifying
    @Query("update WebhookJob j set j.dispatchHandle = :handle where j.id = :id")
    int updateDispatchHandle(@Param("id") Long id, @Param("handle") String handle);

    @Modifying
    @Query("update WebhookJob j set j.dispatchHandle = :handle, j.plannedAt = :plannedAt where j.id = :id")
    int updateOnceSchedule(@Param("id") Long id, @Param("handle") String handle, @Param("plannedAt") Instant plannedAt);

    @Modifying
    @Query("update WebhookJob j set j.periodicTriggerId = :triggerId, j.periodicHandle = :handle, j.plannedAt = :plannedAt " +
            "where j.id = :id")
    int updatePeriodicSchedule(@Param("id") Long id,
                               @Param("triggerId") Long triggerId,
                               @Param("handle") Long handle,
                               @Param("plannedAt") Instant plannedAt);

    @Modifying
    @Query("update WebhookJob j set j.lastExecutionAt = :at where j.id = :id")
    int updateLastExecutionAt(@Param("id") Long id, @Param("at") Instant at);
}
