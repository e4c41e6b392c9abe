package com.example.cronhooks.repo;

import com.example.cronhooks.domain.DispatchTask;
import com.example.cronhooks.domain.TaskStatus;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityManager;
import javax.persistence.LockModeType;
import javax.persistence.PersistenceContext;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Default picker (H2 and anything without a dedicated dialect): plain pessimistic row lock, no skip-locked.
 * Competing instances block on the row instead of skipping it; the conditional markRunning still keeps
 * the claim exclusive.
 */
@Repository
@Profile("!mysql & !db2")
public class PortableTaskPicker implements TaskPicker {

    @PersistenceContext
    private EntityManager em;

    @Override
    @Transactional
    public Optional<Long> lockOnePendingId(Instant now) {
        List<DispatchTask> rows = em.createQuery(
                        "select t from DispatchTask t " +
                                "where t.status = :status and t.notBefore <= :now " +
                                "order by t.notBefore asc, t.id asc", DispatchTask.class)
                .setParameter("status", TaskStatus.PENDING)
                .setParameter("now", now)
                .setLockMode(LockModeType.PESSIMISTIC_WRITE)
                .setMaxResults(1)
                .getResultList();

        return rows.isEmpty()
                ? Optional.empty()
                : Optional.of(rows.get(0).getId());
    }

    @Override
    @Transactional
    public int markRunning(Long id, String owner, Instant now) {
        return em.createQuery(
                        "update DispatchTask t set t.status = :running, t.owner = :owner, " +
                                "t.heartbeatAt = :now, t.updatedAt = :now " +
                                "where t.id = :id and t.status = :pending")
                .setParameter("running", TaskStatus.RUNNING)
                .setParameter("owner", owner)
                .setParameter("now", now)
                .setParameter("id", id)
                .setParameter("pending", TaskStatus.PENDING)
                .executeUpdate();
    }
}
