package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.ExecutionLog;
import com.example.taskhub.scheduler.domain.ExecutionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import javax.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ExecutionLogRepo extends JpaRepository<ExecutionLog, Long> {

    Optional<ExecutionLog> findFirstByJobIdAndStatusInOrderByIdDesc(Long jobId, Collection<ExecutionStatus> statuses);

    boolean existsByJobIdAndStatusAndIdNot(Long jobId, ExecutionStatus status, Long id);

    List<ExecutionLog> findByJobIdOrderByIdDesc(Long jobId, Pageable page);

    List<ExecutionLog> findAllByOrderByIdDesc(Pageable page);

    List<ExecutionLog> findByStatusOrderByIdDesc(ExecutionStatus status, Pageable page);

    List<ExecutionLog> findByJobIdAndStatusOrderByIdDesc(Long jobId, ExecutionStatus status, Pageable page);

    @Query("select l.status, count(l) from ExecutionLog l group by l.status")
    List<Object[]> countByStatus();

    @Query("select avg(l.durationMs) from ExecutionLog l where l.durationMs is not null")
    Double averageDurationMs();

    List<ExecutionLog> findByIdIn(Collection<Long> ids);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from ExecutionLog l where l.id = :id")
    Optional<ExecutionLog> lockById(@Param("id") Long id);
}
