package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.ScheduledJob;
import com.example.taskhub.scheduler.domain.TriggerState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.LockModeType;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public interface ScheduledJobRepo extends JpaRepository<ScheduledJob, Long> {

    @Query("select j from ScheduledJob j where j.triggerState = :state and j.archived = false "
            + "and j.nextFireAt is not null and j.nextFireAt <= :now order by j.nextFireAt asc, j.id asc")
    List<ScheduledJob> findDue(@Param("state") TriggerState state, @Param("now") Timestamp now, Pageable page);

    List<ScheduledJob> findByArchivedFalseOrderByIdAsc();

    List<ScheduledJob> findAllByOrderByIdAsc();

    @Query("select j.triggerState, count(j) from ScheduledJob j where j.archived = false group by j.triggerState")
    List<Object[]> countLiveByTriggerState();

    long countByArchivedTrue();

    /** 与 {@link ScheduledJob#isExhausted()} 同一判定 */
    @Query("select count(j) from ScheduledJob j where j.archived = false and (j.consecutiveFailures >= j.maxFailures "
            + "or (j.maxExecutions is not null and j.executionCount >= j.maxExecutions))")
    long countExhausted();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from ScheduledJob j where j.id = :id")
    Optional<ScheduledJob> lockById(@Param("id") Long id);

    /**
     * 条件更新（CAS）：只有 next_fire_at 仍等于读取到的值、且 job 仍为 ACTIVE 时才成功（返回 1）。
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update ScheduledJob j set j.nextFireAt = :next, j.lastFireAt = :expected "
            + "where j.id = :id and j.nextFireAt = :expected and j.triggerState = :state and j.archived = false")
    int claim(@Param("id") Long id, @Param("expected") Timestamp expected, @Param("next") Timestamp next,
              @Param("state") TriggerState state);

    @Modifying(clearAutomatically = true)
    @Query("update ScheduledJob j set j.executionCount = j.executionCount + 1, j.consecutiveFailures = 0 where j.id = :id")
    int recordSuccess(@Param("id") Long id);

    @Modifying(clearAutomatically = true)
    @Query("update ScheduledJob j set j.consecutiveFailures = j.consecutiveFailures + 1 where j.id = :id")
    int recordFailure(@Param("id") Long id);
}
