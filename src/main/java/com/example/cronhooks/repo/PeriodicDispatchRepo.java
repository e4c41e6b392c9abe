package com.example.cronhooks.repo;

import com.example.cronhooks.domain.PeriodicDispatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface PeriodicDispatchRepo extends JpaRepository<PeriodicDispatch, Long> {

    Optional<PeriodicDispatch> findByJobId(Long jobId);

    List<PeriodicDispatch> findByEnabledTrue();

    long countByTriggerIdAndEnabledTrue(Long triggerId);

    @Modifying
    @Query("update PeriodicDispatch d set d.enabled = :enabled where d.id = :id")
    int updateEnabled(@Param("id") Long id, @Param("enabled") boolean enabled);

    /**
     * Advances the fire cursor only forward, so two scanners racing on the same binding cannot move it back.
     */
    @Modifying
    @Query("update PeriodicDispatch d set d.lastFireAt = :at " +
            "where d.id = :id and (d.lastFireAt is null or d.lastFireAt < :at)")
    int advanceLastFireAt(@Param("id") Long id, @Param("at") Instant at);

    @Modifying
    @Query("delete from PeriodicDispatch d where d.jobId = :jobId")
    int deleteByJobId(@Param("jobId") Long jobId);
}
