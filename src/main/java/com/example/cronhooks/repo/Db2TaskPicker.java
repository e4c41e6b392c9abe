package com.example.cronhooks.repo;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityManager;
import javax.persistence.PersistenceContext;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@Profile("db2")
public class Db2TaskPicker implements TaskPicker {

    @PersistenceContext
    private EntityManager em;

    /**
     * DB2：行级锁 + SKIP LOCKED DATA，短事务内领取一条已到期投递。
     */
    @Override
    @Transactional
    @SuppressWarnings("unchecked")
    public Optional<Long> lockOnePendingId(Instant now) {
        final String sql =
                "SELECT id " +
                        "FROM dispatch_task " +
                        "WHERE status='PENDING' " +
                        "  AND not_before <= ? " +
                        "ORDER BY not_before ASC, id ASC " +
                        "FETCH FIRST 1 ROWS ONLY " +
                        "FOR UPDATE WITH RS SKIP LOCKED DATA";

        List<Number> ids = em.createNativeQuery(sql)
                .setParameter(1, Timestamp.from(now))
                .setMaxResults(1)
                .getResultList();

        return ids.isEmpty()
                ? Optional.empty()
                : Optional.of(ids.get(0).longValue());
    }

    @Override
    @Transactional
    public int markRunning(Long id, String owner, Instant now) {
        final String sql =
                "UPDATE dispatch_task " +
                        "SET status='RUNNING', owner=?, heartbeat_at=?, updated_at=? " +
                        "WHERE id=? AND status='PENDING'";

        Timestamp ts = Timestamp.from(now);
        return em.createNativeQuery(sql)
                .setParameter(1, owner)
                .setParameter(2, ts)
                .setParameter(3, ts)
                .setParameter(4, id)
                .executeUpdate();
    }
}
