package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.ExecutionLog;
import com.example.taskhub.scheduler.domain.ExecutionStatus;
import com.example.taskhub.scheduler.domain.ScheduledJob;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable state of jobs and execution logs. Every write is a short transaction of its own; the
 * conditional writes ({@link #tryClaim}, {@link #transitionExecutionLog}) are the only way the
 * scheduler and workers coordinate across nodes.
 * <p>
 * Implementations throw {@link com.example.taskhub.scheduler.exception.StoreUnavailableException}
 * when the backing store cannot be reached.
 */
public interface JobStore {

    // ---- jobs ----

    ScheduledJob saveJob(ScheduledJob job);

    Optional<ScheduledJob> findJob(Long jobId);

    List<ScheduledJob> listJobs(boolean includeArchived);

    /**
     * Applies {@code change} to the job under a row lock and returns the updated job.
     *
     * @throws com.example.taskhub.scheduler.exception.JobNotFoundException if the job does not exist
     */
    ScheduledJob modifyJob(Long jobId, Consumer<ScheduledJob> change);

    /** ACTIVE, non-archived jobs with {@code next_fire_at <= now}, earliest first. */
    List<ScheduledJob> getDueJobs(Instant now, int limit);

    /**
     * Moves {@code next_fire_at} from {@code expectedNextFireAt} to {@code newNextFireAt}.
     * Returns false when another tick already claimed this firing or the job is no longer ACTIVE.
     */
    boolean tryClaim(Long jobId, Instant expectedNextFireAt, Instant newNextFireAt);

    void recordOutcome(Long jobId, boolean succeeded);

    // ---- execution logs ----

    Long createExecutionLog(ExecutionLog log);

    /**
     * Conditional transition: applied only when the log is currently {@code expected}.
     */
    boolean transitionExecutionLog(Long logId, ExecutionStatus expected, ExecutionStatus next, LogUpdate update);

    /** Latest PENDING or RUNNING log of the job. */
    Optional<ExecutionLog> findOpenLog(Long jobId);

    Optional<ExecutionLog> findLog(Long logId);

    /** Newest first; {@code jobId == null} lists every job. */
    default List<ExecutionLog> listExecutionLogs(Long jobId, int limit) {
        return listExecutionLogs(jobId, null, limit);
    }

    /** Newest first; null {@code jobId} / {@code status} do not filter. */
    List<ExecutionLog> listExecutionLogs(Long jobId, ExecutionStatus status, int limit);

    JobStatistics statistics();

    Map<Long, ExecutionStatus> findStatuses(Collection<Long> logIds);

    // ---- composite writes ----

    /**
     * Inserts a PENDING log and its execution request in one transaction. With {@code skipIfOpen}
     * the job row is locked first and nothing is written when the job already has an open log.
     *
     * @return the stored log, or empty when skipped
     */
    Optional<ExecutionLog> openExecution(ExecutionLog pending, Instant notBefore, boolean skipIfOpen);

    /**
     * {@link #tryClaim} followed by {@link #openExecution} in a single transaction: when the log or the
     * request cannot be written the claim is rolled back too, and the next tick sees the firing again.
     *
     * @return CONFLICT when the claim was lost, SKIPPED when claimed but the job already had an open
     * log and {@code skipIfOpen} was set, otherwise OPENED with the stored log
     */
    FiringOutcome claimAndOpen(Long jobId, Instant expectedNextFireAt, Instant newNextFireAt,
                               ExecutionLog pending, Instant notBefore, boolean skipIfOpen);

    /**
     * RUNNING -> RETRYING on the previous log, plus the PENDING successor and its request, atomically.
     *
     * @return the successor, or empty when the previous log was no longer RUNNING
     */
    Optional<ExecutionLog> openRetry(Long previousLogId, LogUpdate closing, ExecutionLog successor, Instant notBefore);

    /**
     * PENDING -> RUNNING. With {@code exclusivePerJob} the job row is locked and the start is refused
     * while another log of the same job is RUNNING.
     */
    StartOutcome startExecution(Long logId, String owner, Instant startedAt, boolean exclusivePerJob);
}
