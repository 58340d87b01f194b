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
@Profile("mysql")
public class MysqlRequestPicker implements RequestPicker {

    @PersistenceContext
    private EntityManager em;

    /**
     * MySQL 8.0+ 领取一条到期请求：
     * - 仅挑 status='READY' 且 not_before 已到期
     * - SELECT ... FOR UPDATE SKIP LOCKED 实现跳锁
     * - 需在事务中执行（由 JpaExecutionQueue.poll 的事务包裹）
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
                        "LIMIT 1 " +
                        "FOR UPDATE SKIP LOCKED";

        List<Number> ids = em.createNativeQuery(sql)
                .setParameter("now", now)
                .getResultList();

        return ids.isEmpty()
                ? Optional.empty()
                : Optional.of(ids.get(0).longValue());
    }

    /**
     * READY -> CLAIMED，只有在当前仍为 READY 时更新成功（返回 1）。
     */
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
