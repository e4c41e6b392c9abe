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
@Profile("mysql")
public class MysqlTaskPicker implements TaskPicker {

    @PersistenceContext
    private EntityManager em;

    /**
     * MySQL 8.0+：挑一条已到期的 PENDING 投递，FOR UPDATE SKIP LOCKED 跳过别的实例正在领取的行。
     * 到期时间用应用时钟比较，与写入 not_before 的时钟一致。
     */
    @Override
    @Transactional
    @SuppressWarnings("unchecked")
    public Optional<Long> lockOnePendingId(Instant now) {
        final String sql =
                "SELECT id " +
                        "FROM dispatch_task " +
                        "WHERE status='PENDING' " +
                        "  AND not_before <= :now " +
                        "ORDER BY not_before ASC, id ASC " +
                        "LIMIT 1 " +
                        "FOR UPDATE SKIP LOCKED";

        List<Number> ids = em.createNativeQuery(sql)
                .setParameter("now", Timestamp.from(now))
                .getResultList();

        return ids.isEmpty()
                ? Optional.empty()
                : Optional.of(ids.get(0).longValue());
    }

    /**
     * PENDING → RUNNING，仅当仍为 PENDING 时成功（返回 1）。
     */
    @Override
    @Transactional
    public int markRunning(Long id, String owner, Instant now) {
        final String sql =
                "UPDATE dispatch_task " +
                        "SET status='RUNNING', owner=:owner, heartbeat_at=:now, updated_at=:now " +
                        "WHERE id=:id AND status='PENDING'";

        return em.createNativeQuery(sql)
                .setParameter("owner", owner)
                .setParameter("now", Timestamp.from(now))
                .setParameter("id", id)
                .executeUpdate();
    }
}
