package com.example.taskhub.scheduler.repo;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityManager;
import javax.persistence.PersistenceContext;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
@Profile("db2")
public class Db2RequestPicker implements RequestPicker {

    @PersistenceContext
    private EntityManager em;

    /**
     * DB2 领取一条到期请求：
     * - 仅挑 status='READY' 且 not_before 已到期
     * - 行级锁 + 跳过已被其他事务锁定的行
     */
    @Override
    @Transactional
    @SuppressWarnings("unchecked")
    public Optional<Long> lockOneReadyId(Timestamp now) {
        final String sql =
                "SELECT id " +
                        "FROM execution_request " +
                        "WHERE status='READY' " +
                        "  AND not_before <= :now " +
                        "ORDER BY not_before ASC, id ASC " +
                        "FETCH FIRST 1 ROWS ONLY " +
                        "FOR UPDATE WITH RS SKIP LOCKED DATA";

        List<Number> ids = em.createNativeQuery(sql)
                .setParameter("now", now)
                .setMaxResults(1)
                .getResultList();

        return ids.isEmpty()
                ? Optional.empty()
                : Optional.of(ids.get(0).longValue());
    }

    @Override
    @Transactional
    public int markClaimed(Long id, String owner, Timestamp now) {
        final String sql =
                "UPDATE execution_request " +
                        "SET status='CLAIMED', owner=:owner, heartbeat_at=:now " +
                        "WHERE id=:id AND status='READY'";

        return em.createNativeQuery(sql)
                .setParameter("owner", owner)
                .setParameter("now", now)
                .setParameter("id", id)
                .executeUpdate();
    }
}
