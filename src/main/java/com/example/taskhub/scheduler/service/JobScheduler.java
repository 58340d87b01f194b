package com.example.taskhub.scheduler.service;

import com.example.taskhub.scheduler.config.SchedulerProperties;
import com.example.taskhub.scheduler.domain.ConcurrencyPolicy;
import com.example.taskhub.scheduler.domain.ExecutionLog;
import com.example.taskhub.scheduler.domain.ExecutionTrigger;
import com.example.taskhub.scheduler.domain.ScheduledJob;
import com.example.taskhub.scheduler.domain.TriggerState;
import com.example.taskhub.scheduler.exception.InvalidCronExpressionException;
import com.example.taskhub.scheduler.exception.StoreUnavailableException;
import com.example.taskhub.scheduler.repo.FiringOutcome;
import com.example.taskhub.scheduler.repo.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Cron side. Each tick claims the due firings of every ACTIVE job and hands them to the {@link Dispatcher}.
 * Several instances may tick at the same time; the conditional update in {@link JobStore#claimAndOpen}
 * lets exactly one of them enqueue a given firing, and a failed enqueue leaves the firing unclaimed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobScheduler {

    private final JobStore store;
    private final Dispatcher dispatcher;
    private final CronEvaluator cron;
    private final Clock clock;
    private final SchedulerProperties props;

    @Scheduled(fixedDelayString = "${scheduler.tick.delay-ms:10000}",
            initialDelayString = "${scheduler.tick.initial-delay-ms:5000}")
    public void tick() {
        try {
            int fired = fireDue();
            if (fired > 0) {
                log.debug("Tick fired {} job(s)", fired);
            }
        } catch (StoreUnavailableException e) {
            // 下一次 tick 重试
            log.warn("Tick aborted, store unavailable: {}", e.getMessage());
        }
    }

    /**
     * @return number of firings that produced an execution
     */
    public int fireDue() {
        Instant now = clock.instant();
        List<ScheduledJob> due = store.getDueJobs(now, props.getTick().getBatchSize());
        int fired = 0;
        for (ScheduledJob job : due) {
            try {
                if (fireOne(job, now)) fired++;
            } catch (StoreUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Failed to fire job id={} task={}", job.getId(), job.getTaskName(), e);
            }
        }
        return fired;
    }

    private boolean fireOne(ScheduledJob job, Instant now) {
        Instant next;
        try {
            // 从 now 计算下一次，停机期间错过的触发不补发
            next = cron.nextFireTime(job.getCronExpression(), now);
        } catch (InvalidCronExpressionException e) {
            pauseBroken(job, e);
            return false;
        }

        Instant expected = job.getNextFireAt().toInstant();
        if (job.isExhausted()) {
            if (store.tryClaim(job.getId(), expected, next)) {
                log.info("Job id={} exhausted (executions={}/{}, consecutive failures={}/{}), firing at {} not enqueued",
                        job.getId(), job.getExecutionCount(), job.getMaxExecutions(),
                        job.getConsecutiveFailures(), job.getMaxFailures(), expected);
            } else {
                log.debug("Claim conflict job id={} expected={}", job.getId(), expected);
            }
            return false;
        }

        boolean skipIfOpen = job.getConcurrencyPolicy() == ConcurrencyPolicy.SKIP_IF_RUNNING;
        ExecutionLog pending = dispatcher.pendingFor(job, ExecutionTrigger.CRON, null, now);
        FiringOutcome outcome = store.claimAndOpen(job.getId(), expected, next, pending, now, skipIfOpen);
        switch (outcome.getStatus()) {
            case CONFLICT:
                log.debug("Claim conflict job id={} expected={}", job.getId(), expected);
                return false;
            case SKIPPED:
                log.info("Skipped firing of job id={} at {}: previous execution still open", job.getId(), expected);
                return false;
            default:
                log.info("Fired job id={} task={} at {} -> log={}, next={}", job.getId(), job.getTaskName(),
                        expected, outcome.getLog().getId(), next);
                return true;
        }
    }

    /**
     * 已存储的 cron 无法解析（例如版本间校验规则变化）：暂停该 job，只记录一次。
     * 只有 cron 仍是这条坏表达式时才暂停，避免覆盖并发的修正。
     */
    private void pauseBroken(ScheduledJob job, InvalidCronExpressionException e) {
        String broken = job.getCronExpression();
        ScheduledJob after = store.modifyJob(job.getId(), j -> {
            if (broken.equals(j.getCronExpression()) && j.getTriggerState() == TriggerState.ACTIVE) {
                j.setTriggerState(TriggerState.PAUSED);
            }
        });
        if (after.getTriggerState() == TriggerState.PAUSED) {
            log.warn("Paused job id={}: invalid cron '{}': {}", job.getId(), broken, e.getMessage());
        }
    }
}
