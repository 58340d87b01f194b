package com.example.taskhub.scheduler.service;

import com.example.taskhub.scheduler.config.SchedulerProperties;
import com.example.taskhub.scheduler.domain.*;
import com.example.taskhub.scheduler.exception.StoreUnavailableException;
import com.example.taskhub.scheduler.support.InMemoryJobStore;
import com.example.taskhub.scheduler.support.MutableClock;
import com.example.taskhub.scheduler.task.TaskDescriptor;
import com.example.taskhub.scheduler.task.TaskRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.SyncTaskExecutor;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:02:30Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final CronEvaluator cron = new CronEvaluator(ZoneOffset.UTC);
    private InMemoryJobStore store;
    private MutableClock clock;
    private SchedulerProperties props;
    private Dispatcher dispatcher;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        clock = new MutableClock(T0);
        props = new SchedulerProperties();
        setUpOn(store);
    }

    private void setUpOn(InMemoryJobStore store) {
        TaskRegistry registry = new TaskRegistry(mapper);
        registry.register(TaskDescriptor.builder().name("noop").contract((p, c) -> null).build());
        dispatcher = new Dispatcher(store, store, registry, mapper,
                new ExponentialBackoffRetryPolicy(Duration.ofSeconds(2), Duration.ofMinutes(5), 3),
                new SyncTaskExecutor(), new SimpleAsyncTaskExecutor("task-test-"), clock, props);
        scheduler = new JobScheduler(store, dispatcher, cron, clock, props);
    }

    @Test
    void everyFiveMinutes_firesOncePerBoundary() {
        ScheduledJob job = job("*/5 * * * *", ConcurrencyPolicy.ALLOW_OVERLAP);
        assertEquals(Instant.parse("2024-03-01T10:05:00Z"), job.getNextFireAt().toInstant());

        clock.set(Instant.parse("2024-03-01T10:04:59Z"));
        assertEquals(0, scheduler.fireDue());

        clock.set(Instant.parse("2024-03-01T10:05:00Z"));
        assertEquals(1, scheduler.fireDue());
        ScheduledJob after = store.findJob(job.getId()).get();
        assertEquals(Instant.parse("2024-03-01T10:10:00Z"), after.getNextFireAt().toInstant());
        assertEquals(Instant.parse("2024-03-01T10:05:00Z"), after.getLastFireAt().toInstant());

        clock.set(Instant.parse("2024-03-01T10:05:10Z"));
        assertEquals(0, scheduler.fireDue());

        clock.set(Instant.parse("2024-03-01T10:10:03Z"));
        assertEquals(1, scheduler.fireDue());
        assertEquals(2, store.logsOfJob(job.getId()).size());
        assertTrue(store.logsOfJob(job.getId()).stream().allMatch(l -> l.getTrigger() == ExecutionTrigger.CRON));
    }

    @Test
    void missedFirings_areNotReplayed() {
        ScheduledJob job = job("*/5 * * * *", ConcurrencyPolicy.ALLOW_OVERLAP);

        // 停机一小时
        clock.set(Instant.parse("2024-03-01T11:07:00Z"));
        assertEquals(1, scheduler.fireDue());
        assertEquals(0, scheduler.fireDue());
        assertEquals(Instant.parse("2024-03-01T11:10:00Z"), store.findJob(job.getId()).get().getNextFireAt().toInstant());
        assertEquals(1, store.logsOfJob(job.getId()).size());
    }

    @Test
    void concurrentTicks_enqueueExactlyOnce() throws Exception {
        ScheduledJob job = job("*/5 * * * *", ConcurrencyPolicy.ALLOW_OVERLAP);
        clock.set(Instant.parse("2024-03-01T10:05:00Z"));

        int instances = 8;
        List<JobScheduler> schedulers = new ArrayList<>();
        for (int i = 0; i < instances; i++) {
            schedulers.add(new JobScheduler(store, dispatcher, cron, clock, props));
        }
        ExecutorService pool = Executors.newFixedThreadPool(instances);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger fired = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (JobScheduler s : schedulers) {
            futures.add(pool.submit(() -> {
                go.await();
                fired.addAndGet(s.fireDue());
                return null;
            }));
        }
        go.countDown();
        for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        assertEquals(1, fired.get());
        assertEquals(1, store.logsOfJob(job.getId()).size());
    }

    @Test
    void pausedJob_doesNotFire() {
        ScheduledJob job = job("*/5 * * * *", ConcurrencyPolicy.ALLOW_OVERLAP);
        store.modifyJob(job.getId(), j -> j.setTriggerState(TriggerState.PAUSED));

        clock.set(Instant.parse("2024-03-01T10:05:00Z"));
        assertEquals(0, scheduler.fireDue());
        assertTrue(store.logsOfJob(job.getId()).isEmpty());
        assertEquals(Instant.parse("2024-03-01T10:05:00Z"), store.findJob(job.getId()).get().getNextFireAt().toInstant());
    }

    @Test
    void skipIfRunning_claimsFiringButCreatesNoLog() {
        ScheduledJob job = job("*/5 * * * *", ConcurrencyPolicy.SKIP_IF_RUNNING);
        clock.set(Instant.parse("2024-03-01T10:05:00Z"));
        assertEquals(1, scheduler.fireDue());

        // 上一次还在 PENDING
        clock.set(Instant.parse("2024-03-01T10:10:00Z"));
        assertEquals(0, scheduler.fireDue());
        assertEquals(1, store.logsOfJob(job.getId()).size());
        assertEquals(Instant.parse("2024-03-01T10:15:00Z"), store.findJob(job.getId()).get().getNextFireAt().toInstant());
    }

    @Test
    void exhaustedJob_advancesWithoutExecution() {
        ScheduledJob job = job("*/5 * * * *", ConcurrencyPolicy.ALLOW_OVERLAP);
        store.modifyJob(job.getId(), j -> {
            j.setMaxExecutions(1);
            j.setExecutionCount(1);
        });

        clock.set(Instant.parse("2024-03-01T10:05:00Z"));
        assertEquals(0, scheduler.fireDue());
        assertTrue(store.logsOfJob(job.getId()).isEmpty());
        assertEquals(Instant.parse("2024-03-01T10:10:00Z"), store.findJob(job.getId()).get().getNextFireAt().toInstant());
    }

    @Test
    void tooManyFailures_stopsFiring() {
        ScheduledJob job = job("*/5 * * * *", ConcurrencyPolicy.ALLOW_OVERLAP);
        store.modifyJob(job.getId(), j -> j.setConsecutiveFailures(j.getMaxFailures()));

        clock.set(Instant.parse("2024-03-01T10:05:00Z"));
        assertEquals(0, scheduler.fireDue());
        assertTrue(store.logsOfJob(job.getId()).isEmpty());
    }

    @Test
    void storeUnavailable_tickSurvives() {
        job("*/5 * * * *", ConcurrencyPolicy.ALLOW_OVERLAP);
        clock.set(Instant.parse("2024-03-01T10:05:00Z"));
        store.setUnavailable(true);

        assertThrows(StoreUnavailableException.class, () -> scheduler.fireDue());
        assertDoesNotThrow(() -> scheduler.tick());

        store.setUnavailable(false);
        assertEquals(1, scheduler.fireDue());
    }

    @Test
    void invalidCronOnOneJob_doesNotBlockOthers() {
        ScheduledJob broken = job("*/5 * * * *", ConcurrencyPolicy.ALLOW_OVERLAP);
        store.modifyJob(broken.getId(), j -> j.setCronExpression("61 * * * *"));
        ScheduledJob healthy = job("*/5 * * * *", ConcurrencyPolicy.ALLOW_OVERLAP);

        clock.set(Instant.parse("2024-03-01T10:05:00Z"));
        assertEquals(1, scheduler.fireDue());
        assertTrue(store.logsOfJob(broken.getId()).isEmpty());
        assertEquals(1, store.logsOfJob(healthy.getId()).size());

        // 坏 cron 的 job 被暂停，之后的 tick 不再读到它
        ScheduledJob paused = store.findJob(broken.getId()).get();
        assertEquals(TriggerState.PAUSED, paused.getTriggerState());
        assertEquals(Instant.parse("2024-03-01T10:05:00Z"), paused.getNextFireAt().toInstant());
        clock.set(Instant.parse("2024-03-01T10:05:05Z"));
        assertTrue(store.getDueJobs(clock.instant(), 10).isEmpty());
    }

    @Test
    void enqueueFailure_leavesFiringForNextTick() {
        AtomicInteger failures = new AtomicInteger(1);
        InMemoryJobStore flaky = new InMemoryJobStore() {
            @Override
            public synchronized Optional<ExecutionLog> openExecution(ExecutionLog pending, Instant notBefore, boolean skipIfOpen) {
                if (failures.getAndDecrement() > 0) {
                    throw new StoreUnavailableException("connection reset while inserting log", null);
                }
                return super.openExecution(pending, notBefore, skipIfOpen);
            }
        };
        store = flaky;
        setUpOn(flaky);
        ScheduledJob job = job("*/5 * * * *", ConcurrencyPolicy.ALLOW_OVERLAP);

        clock.set(Instant.parse("2024-03-01T10:05:00Z"));
        assertDoesNotThrow(() -> scheduler.tick());
        ScheduledJob afterFailure = store.findJob(job.getId()).get();
        assertEquals(Instant.parse("2024-03-01T10:05:00Z"), afterFailure.getNextFireAt().toInstant());
        assertNull(afterFailure.getLastFireAt());
        assertTrue(store.logsOfJob(job.getId()).isEmpty());

        clock.set(Instant.parse("2024-03-01T10:05:05Z"));
        assertEquals(1, scheduler.fireDue());
        assertEquals(1, store.logsOfJob(job.getId()).size());
        assertEquals(1, store.allRequests().size());
        assertEquals(Instant.parse("2024-03-01T10:10:00Z"), store.findJob(job.getId()).get().getNextFireAt().toInstant());
    }

    private ScheduledJob job(String expr, ConcurrencyPolicy policy) {
        ScheduledJob j = new ScheduledJob();
        j.setTaskName("noop");
        j.setCronExpression(expr);
        j.setParameters("{}");
        j.setConcurrencyPolicy(policy);
        j.setTriggerState(TriggerState.ACTIVE);
        j.setNextFireAt(Timestamp.from(cron.nextFireTime(expr, clock.instant())));
        return store.saveJob(j);
    }
}
