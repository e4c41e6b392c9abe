package com.example.cronhooks.repo;

import com.example.cronhooks.domain.DispatchTask;
import com.example.cronhooks.domain.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

@Repository
public interface DispatchTaskRepo extends JpaRepository<DispatchTask, Long> {

    Optional<DispatchTask> findByTicketNo(String ticketNo);

    long countByJobIdAndStatusIn(Long jobId, Collection<TaskStatus> statuses);

    /**
     * Deduplicated enqueue: a ticket that already exists is not inserted again (returns 0).
     */
    @Modifying
    @Query(value =
            "INSERT INTO dispatch_task(" +
                    "  ticket_no, job_id, attempt_number, status, not_before, created_at, updated_at" +
                    ") " +
                    "SELECT ?1, ?2, ?3, ?4, ?5, ?6, ?6 " +
                    "WHERE NOT EXISTS (SELECT 1 FROM dispatch_task WHERE ticket_no = ?1)",
            nativeQuery = true)
    int insertIfNotExists(
            String ticketNo,
            Long jobId,
            int attemptNumber,
            String status,
            Timestamp notBefore,
            Timestamp createdAt
    );

    @Modifying
    @Query("update DispatchTask t set t.status = com.example.cronhooks.domain.TaskStatus.REVOKED, t.updatedAt = :now " +
            "where t.ticketNo = :ticket and t.status = com.example.cronhooks.domain.TaskStatus.PENDING")
    int revokePending(@Param("ticket") String ticketNo, @Param("now") Instant now);

    @Modifying
    @Query("update DispatchTask t set t.status = :status, t.message = :message, t.finishAt = :finishAt, t.updatedAt = :finishAt " +
            "where t.id = :id and t.status = com.example.cronhooks.domain.TaskStatus.RUNNING")
    int complete(@Param("id") Long id,
                 @Param("status") TaskStatus status,
                 @Param("message") String message,
                 @Param("finishAt") Instant finishAt);

    /**
     * Hands RUNNING tasks whose worker stopped heart-beating back to the queue (at-least-once delivery).
     */
    @Modifying
    @Query("update DispatchTask t set t.status = com.example.cronhooks.domain.TaskStatus.PENDING, t.owner = null, t.updatedAt = :now " +
            "where t.status = com.example.cronhooks.domain.TaskStatus.RUNNING and t.heartbeatAt < :threshold")
    int requeueStale(@Param("threshold") Instant threshold, @Param("now") Instant now);

    @Modifying
    @Query("delete from DispatchTask t " +
            "where t.status in (com.example.cronhooks.domain.TaskStatus.DONE, com.example.cronhooks.domain.TaskStatus.FAILED, " +
            "com.example.cronhooks.domain.TaskStatus.REVOKED) and t.updatedAt < :threshold")
    int deleteFinishedBefore(@Param("threshold") Instant threshold);
}
