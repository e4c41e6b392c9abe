package com.example.cronhooks.repo;

import com.example.cronhooks.domain.AttemptStatus;
import com.example.cronhooks.domain.ExecutionAttempt;
import com.example.cronhooks.domain.FailureKind;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ExecutionAttemptRepo extends JpaRepository<ExecutionAttempt, Long> {

    boolean existsByJobIdAndStatus(Long jobId, AttemptStatus status);

    Optional<ExecutionAttempt> findByDispatchTicket(String dispatchTicket);

    Page<ExecutionAttempt> findByJobIdOrderByExecutedAtDescIdDesc(Long jobId, Pageable pageable);

    List<ExecutionAttempt> findByJobIdOrderByIdAsc(Long jobId);

    Optional<ExecutionAttempt> findFirstByJobIdOrderByExecutedAtDescIdDesc(Long jobId);

    long countByJobId(Long jobId);

    /**
     * PENDING → final status, exactly once. Returns 0 if the row already left PENDING.
     */
    @Modifying
    @Query("update ExecutionAttempt a set a.status = :status, a.responseCode = :code, a.responseBody = :body, " +
            "a.errorMessage = :error, a.failureKind = :kind, a.durationMillis = :duration " +
            "where a.id = :id and a.status = com.example.cronhooks.domain.AttemptStatus.PENDING")
    int recordOutcome(@Param("id") Long id,
                      @Param("status") AttemptStatus status,
                      @Param("code") Integer code,
                      @Param("body") String body,
                      @Param("error") String error,
                      @Param("kind") FailureKind kind,
                      @Param("duration") Long durationMillis);

    @Modifying
    @Query("delete from ExecutionAttempt a where a.jobId = :jobId")
    int deleteByJobId(@Param("jobId") Long jobId);
}
