package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.*;
import com.example.taskhub.scheduler.exception.JobNotFoundException;
import com.example.taskhub.scheduler.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;

/**
 * JobStore on JPA. 每个操作都是独立的短事务（REQUIRES_NEW），提交阶段的异常也会被转换成
 * StoreUnavailableException。
 */
@Slf4j
@Repository
public class JpaJobStore implements JobStore {

    private final ScheduledJobRepo jobRepo;
    private final ExecutionLogRepo logRepo;
    private final ExecutionRequestRepo requestRepo;
    private final TransactionTemplate tx;
    private final TransactionTemplate readTx;

    public JpaJobStore(ScheduledJobRepo jobRepo, ExecutionLogRepo logRepo, ExecutionRequestRepo requestRepo,
                       PlatformTransactionManager txManager) {
        this.jobRepo = jobRepo;
        this.logRepo = logRepo;
        this.requestRepo = requestRepo;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTx.setReadOnly(true);
    }

    @Override
    public ScheduledJob saveJob(ScheduledJob job) {
        return inTx(tx, s -> jobRepo.save(job));
    }

    @Override
    public Optional<ScheduledJob> findJob(Long jobId) {
        return inTx(readTx, s -> jobRepo.findById(jobId));
    }

    @Override
    public List<ScheduledJob> listJobs(boolean includeArchived) {
        return inTx(readTx, s -> includeArchived ? jobRepo.findAllByOrderByIdAsc() : jobRepo.findByArchivedFalseOrderByIdAsc());
    }

    @Override
    public ScheduledJob modifyJob(Long jobId, Consumer<ScheduledJob> change) {
        return inTx(tx, s -> {
            ScheduledJob job = jobRepo.lockById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            change.accept(job);
            return jobRepo.saveAndFlush(job);
        });
    }

    @Override
    public List<ScheduledJob> getDueJobs(Instant now, int limit) {
        return inTx(readTx, s -> jobRepo.findDue(TriggerState.ACTIVE, Timestamp.from(now), PageRequest.of(0, limit)));
    }

    /**
     * 条件更新 next_fire_at（CAS）。输给其他实例不是错误，返回 false 即可。
     */
    @Override
    public boolean tryClaim(Long jobId, Instant expectedNextFireAt, Instant newNextFireAt) {
        try {
            Integer updated = inTx(tx, s -> jobRepo.claim(jobId, Timestamp.from(expectedNextFireAt),
                    Timestamp.from(newNextFireAt), TriggerState.ACTIVE));
            return updated != null && updated == 1;
        } catch (StoreUnavailableException e) {
            if (e.getCause() instanceof ConcurrencyFailureException) {
                log.debug("Claim conflict (lock) job={} expected={}", jobId, expectedNextFireAt);
                return false;
            }
            throw e;
        }
    }

    @Override
    public void recordOutcome(Long jobId, boolean succeeded) {
        if (jobId == null) return;
        inTx(tx, s -> succeeded ? jobRepo.recordSuccess(jobId) : jobRepo.recordFailure(jobId));
    }

    @Override
    public Long createExecutionLog(ExecutionLog log) {
        return inTx(tx, s -> logRepo.save(log).getId());
    }

    @Override
    public boolean transitionExecutionLog(Long logId, ExecutionStatus expected, ExecutionStatus next, LogUpdate update) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalArgumentException("Illegal transition " + expected + " -> " + next);
        }
        Boolean ok = inTx(tx, s -> {
            Optional<ExecutionLog> opt = logRepo.lockById(logId);
            if (!opt.isPresent() || opt.get().getStatus() != expected) {
                return false;
            }
            ExecutionLog l = opt.get();
            l.setStatus(next);
            if (update != null) update.applyTo(l);
            logRepo.save(l);
            return true;
        });
        return Boolean.TRUE.equals(ok);
    }

    @Override
    public Optional<ExecutionLog> findOpenLog(Long jobId) {
        return inTx(readTx, s -> logRepo.findFirstByJobIdAndStatusInOrderByIdDesc(jobId, ExecutionStatus.OPEN));
    }

    @Override
    public Optional<ExecutionLog> findLog(Long logId) {
        return inTx(readTx, s -> logRepo.findById(logId));
    }

    @Override
    public List<ExecutionLog> listExecutionLogs(Long jobId, ExecutionStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        return inTx(readTx, s -> {
            if (jobId == null) {
                return status == null ? logRepo.findAllByOrderByIdDesc(page) : logRepo.findByStatusOrderByIdDesc(status, page);
            }
            return status == null
                    ? logRepo.findByJobIdOrderByIdDesc(jobId, page)
                    : logRepo.findByJobIdAndStatusOrderByIdDesc(jobId, status, page);
        });
    }

    @Override
    public JobStatistics statistics() {
        return inTx(readTx, s -> {
            Map<TriggerState, Long> jobs = new EnumMap<>(TriggerState.class);
            for (Object[] row : jobRepo.countLiveByTriggerState()) {
                jobs.put((TriggerState) row[0], (Long) row[1]);
            }
            Map<ExecutionStatus, Long> logs = new EnumMap<>(ExecutionStatus.class);
            for (ExecutionStatus st : ExecutionStatus.values()) logs.put(st, 0L);
            for (Object[] row : logRepo.countByStatus()) {
                logs.put((ExecutionStatus) row[0], (Long) row[1]);
            }
            return JobStatistics.builder()
                    .activeJobs(jobs.getOrDefault(TriggerState.ACTIVE, 0L))
                    .pausedJobs(jobs.getOrDefault(TriggerState.PAUSED, 0L))
                    .archivedJobs(jobRepo.countByArchivedTrue())
                    .exhaustedJobs(jobRepo.countExhausted())
                    .executionsByStatus(logs)
                    .averageDurationMs(logRepo.averageDurationMs())
                    .build();
        });
    }

    @Override
    public Map<Long, ExecutionStatus> findStatuses(Collection<Long> logIds) {
        if (logIds == null || logIds.isEmpty()) return Collections.emptyMap();
        return inTx(readTx, s -> {
            Map<Long, ExecutionStatus> out = new HashMap<>();
            for (ExecutionLog l : logRepo.findByIdIn(logIds)) {
                out.put(l.getId(), l.getStatus());
            }
            return out;
        });
    }

    @Override
    public Optional<ExecutionLog> openExecution(ExecutionLog pending, Instant notBefore, boolean skipIfOpen) {
        return inTx(tx, s -> insertPending(pending, notBefore, skipIfOpen));
    }

    /**
     * 领取与入队同一事务：log / request 写入失败时 next_fire_at 一并回滚，这次触发不会丢。
     */
    @Override
    public FiringOutcome claimAndOpen(Long jobId, Instant expectedNextFireAt, Instant newNextFireAt,
                                      ExecutionLog pending, Instant notBefore, boolean skipIfOpen) {
        try {
            return inTx(tx, s -> {
                int updated = jobRepo.claim(jobId, Timestamp.from(expectedNextFireAt),
                        Timestamp.from(newNextFireAt), TriggerState.ACTIVE);
                if (updated != 1) {
                    return FiringOutcome.conflict();
                }
                return insertPending(pending, notBefore, skipIfOpen)
                        .map(FiringOutcome::opened)
                        .orElseGet(FiringOutcome::skipped);
            });
        } catch (StoreUnavailableException e) {
            if (e.getCause() instanceof ConcurrencyFailureException) {
                log.debug("Claim conflict (lock) job={} expected={}", jobId, expectedNextFireAt);
                return FiringOutcome.conflict();
            }
            throw e;
        }
    }

    // 调用方已在事务内
    private Optional<ExecutionLog> insertPending(ExecutionLog pending, Instant notBefore, boolean skipIfOpen) {
        Long jobId = pending.getJobId();
        if (jobId != null) {
            // 锁 job 行：同一 job 的 open 检查 + 插入串行化
            jobRepo.lockById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (skipIfOpen && logRepo.findFirstByJobIdAndStatusInOrderByIdDesc(jobId, ExecutionStatus.OPEN).isPresent()) {
                return Optional.empty();
            }
        }
        pending.setStatus(ExecutionStatus.PENDING);
        ExecutionLog saved = logRepo.save(pending);
        enqueue(saved, notBefore);
        return Optional.of(saved);
    }

    @Override
    public Optional<ExecutionLog> openRetry(Long previousLogId, LogUpdate closing, ExecutionLog successor, Instant notBefore) {
        return inTx(tx, s -> {
            Optional<ExecutionLog> prevOpt = logRepo.lockById(previousLogId);
            if (!prevOpt.isPresent() || prevOpt.get().getStatus() != ExecutionStatus.RUNNING) {
                return Optional.<ExecutionLog>empty();
            }
            ExecutionLog prev = prevOpt.get();
            prev.setStatus(ExecutionStatus.RETRYING);
            if (closing != null) closing.applyTo(prev);
            logRepo.save(prev);

            successor.setPreviousLogId(prev.getId());
            successor.setStatus(ExecutionStatus.PENDING);
            ExecutionLog saved = logRepo.save(successor);
            enqueue(saved, notBefore);
            return Optional.of(saved);
        });
    }

    @Override
    public StartOutcome startExecution(Long logId, String owner, Instant startedAt, boolean exclusivePerJob) {
        return inTx(tx, s -> {
            Optional<ExecutionLog> peek = logRepo.findById(logId);
            if (!peek.isPresent()) return StartOutcome.NOT_PENDING;
            Long jobId = peek.get().getJobId();
            if (exclusivePerJob && jobId != null) {
                // 先锁 job 再锁 log，与 openExecution 的加锁顺序一致
                jobRepo.lockById(jobId);
            }
            Optional<ExecutionLog> opt = logRepo.lockById(logId);
            if (!opt.isPresent() || opt.get().getStatus() != ExecutionStatus.PENDING) {
                return StartOutcome.NOT_PENDING;
            }
            if (exclusivePerJob && jobId != null
                    && logRepo.existsByJobIdAndStatusAndIdNot(jobId, ExecutionStatus.RUNNING, logId)) {
                return StartOutcome.BUSY;
            }
            ExecutionLog l = opt.get();
            l.setStatus(ExecutionStatus.RUNNING);
            l.setOwner(owner);
            l.setStartedAt(Timestamp.from(startedAt));
            logRepo.save(l);
            return StartOutcome.STARTED;
        });
    }

    private void enqueue(ExecutionLog saved, Instant notBefore) {
        ExecutionRequest req = new ExecutionRequest();
        req.setLogId(saved.getId());
        req.setJobId(saved.getJobId());
        req.setStatus(RequestStatus.READY);
        req.setNotBefore(Timestamp.from(notBefore));
        requestRepo.save(req);
    }

    private static <T> T inTx(TransactionTemplate template, TransactionCallback<T> action) {
        try {
            return template.execute(action);
        } catch (DataAccessException | TransactionException e) {
            throw new StoreUnavailableException("Job store unavailable: " + e.getMessage(), e);
        }
    }
}
