package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.*;
import com.example.taskhub.scheduler.exception.JobNotFoundException;
import com.example.taskhub.scheduler.exception.StoreUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 走真实的 REQUIRES_NEW 事务，测试方法本身不包事务。
 */
@DataJpaTest
@Import({JpaJobStore.class, JpaExecutionQueue.class, PortableRequestPicker.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaJobStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:05:00Z");

    @Autowired
    private JobStore store;
    @Autowired
    private ExecutionQueue queue;
    @Autowired
    private ScheduledJobRepo jobRepo;
    @Autowired
    private ExecutionLogRepo logRepo;
    @Autowired
    private ExecutionRequestRepo requestRepo;

    @AfterEach
    void cleanUp() {
        requestRepo.deleteAll();
        logRepo.deleteAll();
        jobRepo.deleteAll();
    }

    @Test
    void dueJobs_onlyActiveAndNotArchived_oldestFirst() {
        ScheduledJob later = store.saveJob(job(T0.minusSeconds(10)));
        ScheduledJob earlier = store.saveJob(job(T0.minusSeconds(60)));
        ScheduledJob future = store.saveJob(job(T0.plusSeconds(60)));
        ScheduledJob paused = job(T0.minusSeconds(30));
        paused.setTriggerState(TriggerState.PAUSED);
        store.saveJob(paused);
        ScheduledJob archived = job(T0.minusSeconds(30));
        archived.setArchived(true);
        store.saveJob(archived);

        List<ScheduledJob> due = store.getDueJobs(T0, 10);
        assertEquals(Arrays.asList(earlier.getId(), later.getId()), ids(due));
        assertEquals(1, store.getDueJobs(T0, 1).size());
        assertFalse(ids(due).contains(future.getId()));

        assertEquals(4, store.listJobs(false).size());
        assertEquals(5, store.listJobs(true).size());
    }

    @Test
    void tryClaim_isConditionalOnExpectedNextFire() {
        ScheduledJob job = store.saveJob(job(T0));
        Instant next = T0.plusSeconds(300);

        assertTrue(store.tryClaim(job.getId(), T0, next));
        assertFalse(store.tryClaim(job.getId(), T0, next));

        ScheduledJob after = store.findJob(job.getId()).get();
        assertEquals(next, after.getNextFireAt().toInstant());
        assertEquals(T0, after.getLastFireAt().toInstant());
    }

    @Test
    void tryClaim_pausedJobIsNotClaimed() {
        ScheduledJob job = job(T0);
        job.setTriggerState(TriggerState.PAUSED);
        job = store.saveJob(job);
        assertFalse(store.tryClaim(job.getId(), T0, T0.plusSeconds(300)));
    }

    @Test
    void modifyJob_missingJob() {
        assertThrows(JobNotFoundException.class, () -> store.modifyJob(404L, j -> j.setDescription("x")));
    }

    @Test
    void recordOutcome_countsSuccessesAndFailureStreak() {
        ScheduledJob job = store.saveJob(job(T0));
        store.recordOutcome(job.getId(), false);
        store.recordOutcome(job.getId(), false);
        assertEquals(2, store.findJob(job.getId()).get().getConsecutiveFailures());

        store.recordOutcome(job.getId(), true);
        ScheduledJob after = store.findJob(job.getId()).get();
        assertEquals(1, after.getExecutionCount());
        assertEquals(0, after.getConsecutiveFailures());
        store.recordOutcome(null, true);
    }

    @Test
    void openExecution_skipsWhenOpenAndEnqueues() {
        ScheduledJob job = store.saveJob(job(T0));

        Optional<ExecutionLog> first = store.openExecution(pending(job.getId()), T0, true);
        assertTrue(first.isPresent());
        assertFalse(store.openExecution(pending(job.getId()), T0, true).isPresent());
        assertTrue(store.openExecution(pending(job.getId()), T0, false).isPresent());

        assertEquals(2, logRepo.count());
        assertEquals(2, requestRepo.count());
        assertEquals(first.get().getId(), requestRepo.findAll().stream()
                .map(ExecutionRequest::getLogId).min(Long::compare).get());
    }

    @Test
    void claimAndOpen_claimsAndEnqueuesTogether() {
        ScheduledJob job = store.saveJob(job(T0));
        Instant next = T0.plusSeconds(300);

        FiringOutcome first = store.claimAndOpen(job.getId(), T0, next, pending(job.getId()), T0, false);
        assertEquals(FiringOutcome.Status.OPENED, first.getStatus());
        assertEquals(ExecutionStatus.PENDING, store.findLog(first.getLog().getId()).get().getStatus());
        assertEquals(1, requestRepo.count());

        FiringOutcome again = store.claimAndOpen(job.getId(), T0, next, pending(job.getId()), T0, false);
        assertEquals(FiringOutcome.Status.CONFLICT, again.getStatus());
        assertFalse(again.isClaimed());
        assertEquals(1, logRepo.count());

        // 有 open log：领取成功但不入队
        FiringOutcome skipped = store.claimAndOpen(job.getId(), next, next.plusSeconds(300), pending(job.getId()), next, true);
        assertEquals(FiringOutcome.Status.SKIPPED, skipped.getStatus());
        assertTrue(skipped.isClaimed());
        assertEquals(next.plusSeconds(300), store.findJob(job.getId()).get().getNextFireAt().toInstant());
        assertEquals(1, logRepo.count());
    }

    @Test
    void claimAndOpen_rollsBackClaimWhenLogCannotBeWritten() {
        ScheduledJob job = store.saveJob(job(T0));
        ExecutionLog broken = pending(job.getId());
        broken.setTaskName(null);   // task_name NOT NULL

        assertThrows(StoreUnavailableException.class,
                () -> store.claimAndOpen(job.getId(), T0, T0.plusSeconds(300), broken, T0, false));

        ScheduledJob after = store.findJob(job.getId()).get();
        assertEquals(T0, after.getNextFireAt().toInstant());
        assertNull(after.getLastFireAt());
        assertEquals(0, logRepo.count());
        assertEquals(0, requestRepo.count());
        assertEquals(1, store.getDueJobs(T0, 10).size());

        FiringOutcome retried = store.claimAndOpen(job.getId(), T0, T0.plusSeconds(300), pending(job.getId()), T0, false);
        assertEquals(FiringOutcome.Status.OPENED, retried.getStatus());
    }

    @Test
    void openExecution_unknownJob() {
        assertThrows(JobNotFoundException.class, () -> store.openExecution(pending(404L), T0, false));
        assertEquals(0, logRepo.count());
    }

    @Test
    void transition_checksExpectedStatusAndLegality() {
        ScheduledJob job = store.saveJob(job(T0));
        Long logId = store.openExecution(pending(job.getId()), T0, false).get().getId();

        assertFalse(store.transitionExecutionLog(logId, ExecutionStatus.RUNNING, ExecutionStatus.SUCCEEDED, LogUpdate.none()));
        assertTrue(store.transitionExecutionLog(logId, ExecutionStatus.PENDING, ExecutionStatus.CANCELLED,
                LogUpdate.builder().finishedAt(T0).errorKind(ErrorKind.CANCELLED).build()));
        assertThrows(IllegalArgumentException.class,
                () -> store.transitionExecutionLog(logId, ExecutionStatus.CANCELLED, ExecutionStatus.RUNNING, LogUpdate.none()));

        ExecutionLog log = store.findLog(logId).get();
        assertEquals(ExecutionStatus.CANCELLED, log.getStatus());
        assertEquals(ErrorKind.CANCELLED, log.getErrorKind());
        assertEquals(T0, log.getFinishedAt().toInstant());
        assertFalse(store.findOpenLog(job.getId()).isPresent());
    }

    @Test
    void startExecution_exclusiveJobIsBusyWhileAnotherRuns() {
        ScheduledJob job = store.saveJob(job(T0));
        Long a = store.openExecution(pending(job.getId()), T0, false).get().getId();
        Long b = store.openExecution(pending(job.getId()), T0, false).get().getId();

        assertEquals(StartOutcome.STARTED, store.startExecution(a, "node-1", T0, true));
        assertEquals(StartOutcome.BUSY, store.startExecution(b, "node-2", T0, true));
        assertEquals(StartOutcome.NOT_PENDING, store.startExecution(a, "node-2", T0, true));

        ExecutionLog running = store.findLog(a).get();
        assertEquals("node-1", running.getOwner());
        assertEquals(T0, running.getStartedAt().toInstant());

        assertEquals(StartOutcome.STARTED, store.startExecution(b, "node-2", T0, false));
    }

    @Test
    void openRetry_closesPreviousAndChainsSuccessor() {
        ScheduledJob job = store.saveJob(job(T0));
        Long first = store.openExecution(pending(job.getId()), T0, false).get().getId();
        ExecutionRequest firstRequest = queue.poll("node-1", T0).get();
        store.startExecution(first, "node-1", T0, false);

        ExecutionLog successor = pending(job.getId());
        successor.setAttempt(2);
        successor.setTrigger(ExecutionTrigger.RETRY);
        Instant retryAt = T0.plusSeconds(2);
        ExecutionLog next = store.openRetry(first,
                LogUpdate.builder().finishedAt(T0).errorKind(ErrorKind.TASK_EXECUTION).errorMessage("boom").build(),
                successor, retryAt).get();

        ExecutionLog closed = store.findLog(first).get();
        assertEquals(ExecutionStatus.RETRYING, closed.getStatus());
        assertEquals("boom", closed.getErrorMessage());
        assertEquals(first, next.getPreviousLogId());
        assertEquals(ExecutionStatus.PENDING, store.findLog(next.getId()).get().getStatus());
        assertEquals(next.getId(), store.findOpenLog(job.getId()).get().getId());

        // 已不是 RUNNING，不能再开一次
        assertFalse(store.openRetry(first, LogUpdate.none(), pending(job.getId()), retryAt).isPresent());

        queue.acknowledge(firstRequest.getId());
        assertFalse(queue.poll("node-1", T0).isPresent());
        ExecutionRequest req = queue.poll("node-1", retryAt).get();
        assertEquals(next.getId(), req.getLogId());
    }

    @Test
    void queue_claimAckReleaseAndLease() {
        ScheduledJob job = store.saveJob(job(T0));
        Long logId = store.openExecution(pending(job.getId()), T0, false).get().getId();

        ExecutionRequest claimed = queue.poll("node-1", T0).get();
        assertEquals(logId, claimed.getLogId());
        assertEquals(RequestStatus.CLAIMED, claimed.getStatus());
        assertEquals("node-1", claimed.getOwner());
        assertFalse(queue.poll("node-2", T0).isPresent());

        queue.release(claimed.getId(), T0.plusSeconds(1));
        assertFalse(queue.poll("node-2", T0).isPresent());
        ExecutionRequest again = queue.poll("node-2", T0.plusSeconds(1)).get();
        assertEquals(claimed.getId(), again.getId());

        // 心跳续租后不会被回收
        queue.heartbeat(Arrays.asList(again.getId()), T0.plusSeconds(60));
        assertEquals(0, queue.requeueExpired(T0.plusSeconds(30)));
        assertEquals(1, queue.requeueExpired(T0.plusSeconds(61)));

        ExecutionRequest third = queue.poll("node-3", T0.plusSeconds(61)).get();
        queue.acknowledge(third.getId());
        assertEquals(RequestStatus.DONE, requestRepo.findById(third.getId()).get().getStatus());
        assertFalse(queue.poll("node-3", T0.plusSeconds(3600)).isPresent());
    }

    @Test
    void listAndStatusLookups() {
        ScheduledJob job = store.saveJob(job(T0));
        Long a = store.openExecution(pending(job.getId()), T0, false).get().getId();
        Long b = store.openExecution(pending(job.getId()), T0, false).get().getId();
        ExecutionLog adHoc = pending(null);
        Long c = store.openExecution(adHoc, T0, false).get().getId();

        assertEquals(Arrays.asList(b, a), logIds(store.listExecutionLogs(job.getId(), 10)));
        assertEquals(Arrays.asList(c, b), logIds(store.listExecutionLogs(null, 2)));

        store.startExecution(a, "node-1", T0, false);
        Map<Long, ExecutionStatus> statuses = store.findStatuses(Arrays.asList(a, b, 999L));
        assertEquals(2, statuses.size());
        assertEquals(ExecutionStatus.RUNNING, statuses.get(a));
        assertEquals(ExecutionStatus.PENDING, statuses.get(b));
    }

    @Test
    void listExecutionLogs_byStatus() {
        ScheduledJob job = store.saveJob(job(T0));
        Long a = store.openExecution(pending(job.getId()), T0, false).get().getId();
        Long b = store.openExecution(pending(job.getId()), T0, false).get().getId();
        Long c = store.openExecution(pending(null), T0, false).get().getId();
        store.startExecution(a, "node-1", T0, false);
        store.startExecution(c, "node-1", T0, false);

        assertEquals(Arrays.asList(c, a), logIds(store.listExecutionLogs(null, ExecutionStatus.RUNNING, 10)));
        assertEquals(Arrays.asList(a), logIds(store.listExecutionLogs(job.getId(), ExecutionStatus.RUNNING, 10)));
        assertEquals(Arrays.asList(b), logIds(store.listExecutionLogs(job.getId(), ExecutionStatus.PENDING, 10)));
        assertEquals(Arrays.asList(c), logIds(store.listExecutionLogs(null, ExecutionStatus.RUNNING, 1)));
        assertTrue(store.listExecutionLogs(job.getId(), ExecutionStatus.FAILED, 10).isEmpty());
    }

    @Test
    void statistics_countsJobsLogsAndDurations() {
        ScheduledJob active = store.saveJob(job(T0));
        ScheduledJob paused = job(T0);
        paused.setTriggerState(TriggerState.PAUSED);
        store.saveJob(paused);
        ScheduledJob archived = job(T0);
        archived.setArchived(true);
        store.saveJob(archived);
        ScheduledJob worn = job(T0);
        worn.setConsecutiveFailures(3);
        store.saveJob(worn);

        Long ok = store.openExecution(pending(active.getId()), T0, false).get().getId();
        Long bad = store.openExecution(pending(active.getId()), T0, false).get().getId();
        store.openExecution(pending(null), T0, false);
        store.startExecution(ok, "node-1", T0, false);
        store.startExecution(bad, "node-1", T0, false);
        assertTrue(store.transitionExecutionLog(ok, ExecutionStatus.RUNNING, ExecutionStatus.SUCCEEDED,
                LogUpdate.finishedAt(T0.plusMillis(1000))));
        assertTrue(store.transitionExecutionLog(bad, ExecutionStatus.RUNNING, ExecutionStatus.FAILED,
                LogUpdate.failure(T0.plusMillis(3000), ErrorKind.TASK_EXECUTION, "boom")));

        JobStatistics stats = store.statistics();
        assertEquals(2, stats.getActiveJobs());
        assertEquals(1, stats.getPausedJobs());
        assertEquals(1, stats.getArchivedJobs());
        assertEquals(1, stats.getExhaustedJobs());
        assertEquals(1L, stats.getExecutionsByStatus().get(ExecutionStatus.SUCCEEDED));
        assertEquals(1L, stats.getExecutionsByStatus().get(ExecutionStatus.FAILED));
        assertEquals(1L, stats.getExecutionsByStatus().get(ExecutionStatus.PENDING));
        assertEquals(0L, stats.getExecutionsByStatus().get(ExecutionStatus.CANCELLED));
        assertEquals(50.0, stats.getSuccessRate());
        assertEquals(2000.0, stats.getAverageDurationMs());
        assertEquals(Long.valueOf(1000), logRepo.findById(ok).get().getDurationMs());
    }

    private static ScheduledJob job(Instant nextFireAt) {
        ScheduledJob j = new ScheduledJob();
        j.setTaskName("send_email");
        j.setCronExpression("*/5 * * * *");
        j.setParameters("{}");
        j.setConcurrencyPolicy(ConcurrencyPolicy.QUEUE);
        j.setNextFireAt(Timestamp.from(nextFireAt));
        return j;
    }

    private static ExecutionLog pending(Long jobId) {
        ExecutionLog l = new ExecutionLog();
        l.setJobId(jobId);
        l.setTaskName("send_email");
        l.setParameters("{}");
        l.setStatus(ExecutionStatus.PENDING);
        l.setTrigger(ExecutionTrigger.CRON);
        l.setAttempt(1);
        return l;
    }

    private static List<Long> ids(List<ScheduledJob> jobs) {
        return jobs.stream().map(ScheduledJob::getId).collect(Collectors.toList());
    }

    private static List<Long> logIds(List<ExecutionLog> logs) {
        return logs.stream().map(ExecutionLog::getId).collect(Collectors.toList());
    }
}
