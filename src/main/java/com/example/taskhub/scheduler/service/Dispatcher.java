package com.example.taskhub.scheduler.service;

import com.example.taskhub.scheduler.config.SchedulerProperties;
import com.example.taskhub.scheduler.domain.*;
import com.example.taskhub.scheduler.exception.*;
import com.example.taskhub.scheduler.repo.ExecutionQueue;
import com.example.taskhub.scheduler.repo.JobStore;
import com.example.taskhub.scheduler.repo.LogUpdate;
import com.example.taskhub.scheduler.repo.StartOutcome;
import com.example.taskhub.scheduler.task.BoundParameters;
import com.example.taskhub.scheduler.task.TaskContext;
import com.example.taskhub.scheduler.task.TaskDescriptor;
import com.example.taskhub.scheduler.task.TaskRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;

/**
 * Worker side: enqueue executions, claim them from the queue and run task bodies under a timeout.
 * <p>
 * At most {@code scheduler.dispatcher.workers} requests are claimed at once on this node; a request is
 * only taken from the queue after a slot has been acquired.
 */
@Slf4j
@Service
public class Dispatcher {

    private final JobStore store;
    private final ExecutionQueue queue;
    private final TaskRegistry registry;
    private final ObjectMapper mapper;
    private final RetryPolicy defaultRetryPolicy;
    private final TaskExecutor workerExec;
    private final AsyncTaskExecutor taskBodyExec;
    private final Clock clock;
    private final SchedulerProperties props;

    private final Semaphore slots;
    private final String owner;

    // logId -> 本节点正在执行的任务（中断 / 心跳用）
    private final Map<Long, RunningExecution> running = new ConcurrentHashMap<>();

    public Dispatcher(JobStore store, ExecutionQueue queue, TaskRegistry registry, ObjectMapper mapper,
                      RetryPolicy defaultRetryPolicy,
                      @Qualifier("workerExec") TaskExecutor workerExec,
                      @Qualifier("taskBodyExec") AsyncTaskExecutor taskBodyExec,
                      Clock clock, SchedulerProperties props) {
        this.store = store;
        this.queue = queue;
        this.registry = registry;
        this.mapper = mapper;
        this.defaultRetryPolicy = defaultRetryPolicy;
        this.workerExec = workerExec;
        this.taskBodyExec = taskBodyExec;
        this.clock = clock;
        this.props = props;
        this.slots = new Semaphore(Math.max(1, props.getDispatcher().getWorkers()));
        this.owner = resolveOwner(props.getDispatcher().getOwnerId());
    }

    // ------------------------------------------------------------------ enqueue

    /**
     * Opens a PENDING execution for {@code job} and queues it for immediate pickup.
     *
     * @param parametersJson parameters for this execution only; null means the job's own parameters
     * @param force          when true SKIP_IF_RUNNING is not honored
     * @return the new log, or empty when skipped because the job already has an open execution
     */
    public Optional<ExecutionLog> dispatch(ScheduledJob job, ExecutionTrigger trigger, String parametersJson, boolean force) {
        Instant now = clock.instant();
        ExecutionLog pending = pendingFor(job, trigger, parametersJson, now);
        boolean skipIfOpen = !force && job.getConcurrencyPolicy() == ConcurrencyPolicy.SKIP_IF_RUNNING;

        Optional<ExecutionLog> opened = store.openExecution(pending, now, skipIfOpen);
        opened.ifPresent(l -> log.debug("Enqueued {} execution log={} job={} task={}", trigger, l.getId(), job.getId(), job.getTaskName()));
        return opened;
    }

    /**
     * Unsaved PENDING log for one execution of {@code job}; {@code parametersJson == null} takes the job's own.
     */
    ExecutionLog pendingFor(ScheduledJob job, ExecutionTrigger trigger, String parametersJson, Instant now) {
        return newLog(job.getId(), job.getTaskName(),
                parametersJson != null ? parametersJson : job.getParameters(), trigger, now);
    }

    /**
     * One-off execution not bound to any job.
     */
    public ExecutionLog dispatchAdHoc(String taskName, String parametersJson) {
        Instant now = clock.instant();
        ExecutionLog pending = newLog(null, taskName, parametersJson, ExecutionTrigger.MANUAL, now);
        ExecutionLog opened = store.openExecution(pending, now, false)
                .orElseThrow(() -> new IllegalStateException("Ad-hoc execution was not enqueued"));
        log.info("Enqueued ad-hoc execution log={} task={}", opened.getId(), taskName);
        return opened;
    }

    // ------------------------------------------------------------------ worker loop

    /**
     * 领取一个请求并交给 worker 线程。没有空闲 slot 或队列为空时返回 false。
     */
    public boolean pollAndRunOnce() {
        if (!slots.tryAcquire()) {
            return false;
        }
        Optional<ExecutionRequest> opt;
        try {
            opt = queue.poll(owner, clock.instant());
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }
        if (!opt.isPresent()) {
            slots.release();
            return false;
        }

        ExecutionRequest request = opt.get();
        try {
            workerExec.execute(() -> {
                try {
                    execute(request);
                } finally {
                    slots.release();
                }
            });
        } catch (TaskRejectedException e) {
            slots.release();
            log.warn("Worker pool rejected request={} log={}, handing it back", request.getId(), request.getLogId());
            queue.release(request.getId(), clock.instant());
        }
        return true;
    }

    /**
     * 执行一个已领取的请求。所有执行错误都写进 ExecutionLog，不会抛给调用方。
     */
    void execute(ExecutionRequest request) {
        Long logId = request.getLogId();
        boolean settled = true;
        try {
            Optional<ExecutionLog> opt = store.findLog(logId);
            if (!opt.isPresent()) {
                log.warn("Execution log {} of request {} not found, dropping request", logId, request.getId());
                return;
            }
            ExecutionLog entry = opt.get();

            if (entry.getStatus() == ExecutionStatus.RUNNING) {
                if (running.containsKey(logId)) {
                    // 本节点仍在执行，由原 worker 负责 ack
                    settled = false;
                    return;
                }
                // 租约过期后被重新投递：原 worker 已失联
                log.warn("Execution log={} was RUNNING on {} whose lease expired", logId, entry.getOwner());
                handleFailure(entry, registry.find(entry.getTaskName()).orElse(null),
                        new TaskExecutionException("Worker " + entry.getOwner() + " lost while running", null));
                return;
            }
            if (entry.getStatus() != ExecutionStatus.PENDING) {
                log.debug("Execution log={} is {}, nothing to run", logId, entry.getStatus());
                return;
            }

            TaskDescriptor descriptor;
            BoundParameters params;
            try {
                descriptor = registry.resolve(entry.getTaskName());
                params = registry.validate(descriptor, parseParameters(entry));
            } catch (UnknownTaskException | ParameterValidationException e) {
                failBeforeStart(entry, e);
                return;
            }

            boolean exclusive = entry.getJobId() != null && store.findJob(entry.getJobId())
                    .map(j -> j.getConcurrencyPolicy() == ConcurrencyPolicy.QUEUE)
                    .orElse(false);
            StartOutcome outcome = store.startExecution(logId, owner, clock.instant(), exclusive);
            if (outcome == StartOutcome.BUSY) {
                Instant retryAt = clock.instant().plusMillis(props.getDispatcher().getQueueRecheckMs());
                log.debug("Job {} already has a running execution, log={} waits until {}", entry.getJobId(), logId, retryAt);
                queue.release(request.getId(), retryAt);
                settled = false;
                return;
            }
            if (outcome == StartOutcome.NOT_PENDING) {
                log.debug("Execution log={} left PENDING before it could start", logId);
                return;
            }
            run(entry, descriptor, params, request.getId());
        } catch (StoreUnavailableException e) {
            // 不 ack：租约过期后会被重新领取
            settled = false;
            log.error("Store unavailable while executing request={} log={}: {}", request.getId(), logId, e.getMessage());
        } finally {
            if (settled) {
                acknowledgeQuietly(request.getId());
            }
        }
    }

    private void run(ExecutionLog entry, TaskDescriptor descriptor, BoundParameters params, Long requestId) {
        Long logId = entry.getId();
        Duration timeout = descriptor.getTimeout() != null
                ? descriptor.getTimeout()
                : Duration.ofMillis(props.getDefaultTimeoutMs());
        TaskContext ctx = new TaskContext(logId, entry.getJobId(), entry.getAttempt());

        log.info("Start execute log={} job={} task={} attempt={}", logId, entry.getJobId(), entry.getTaskName(), entry.getAttempt());

        Future<JsonNode> future;
        try {
            future = taskBodyExec.submit(() -> descriptor.getContract().execute(params, ctx));
        } catch (TaskRejectedException e) {
            handleFailure(entry, descriptor, new TaskExecutionException("Task executor saturated", e));
            return;
        }
        running.put(logId, new RunningExecution(requestId, ctx, future));

        Throwable failure = null;
        JsonNode result = null;
        try {
            result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            // slot 立即回收，任务体只收到中断，不等待其退出
            ctx.cancel();
            future.cancel(true);
            failure = new TaskTimeoutException(entry.getTaskName(), timeout);
        } catch (CancellationException ce) {
            log.info("Execution log={} cancelled while running", logId);
            return;
        } catch (ExecutionException ee) {
            failure = ee.getCause() != null ? ee.getCause() : ee;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            ctx.cancel();
            future.cancel(true);
            failure = new TaskExecutionException("Worker interrupted", ie);
        } finally {
            running.remove(logId);
        }

        if (failure == null) {
            complete(entry, result);
        } else if (ctx.getCancelled().get() && !(failure instanceof TaskTimeoutException)) {
            log.info("Execution log={} stopped after cancellation", logId);
        } else {
            handleFailure(entry, descriptor, failure);
        }
    }

    private void complete(ExecutionLog entry, JsonNode result) {
        LogUpdate update = LogUpdate.builder()
                .finishedAt(clock.instant())
                .result(result == null ? null : result.toString())
                .build();
        if (store.transitionExecutionLog(entry.getId(), ExecutionStatus.RUNNING, ExecutionStatus.SUCCEEDED, update)) {
            store.recordOutcome(entry.getJobId(), true);
            log.info("Execution log={} task={} succeeded", entry.getId(), entry.getTaskName());
        } else {
            log.info("Execution log={} finished but is no longer RUNNING, result dropped", entry.getId());
        }
    }

    /**
     * 失败：按 RetryPolicy 决定 RETRYING + 新 attempt，或 FAILED。
     */
    private void handleFailure(ExecutionLog entry, TaskDescriptor descriptor, Throwable error) {
        ErrorKind kind = ErrorKind.of(error);
        Instant now = clock.instant();
        LogUpdate closing = LogUpdate.failure(now, kind, describe(error));

        RetryPolicy policy = descriptor != null && descriptor.getRetryPolicy() != null
                ? descriptor.getRetryPolicy()
                : defaultRetryPolicy;
        RetryDecision decision = policy.decide(entry.getAttempt(), error);

        if (decision.isRetry()) {
            Instant notBefore = now.plus(decision.getDelay());
            ExecutionLog successor = newLog(entry.getJobId(), entry.getTaskName(), entry.getParameters(), ExecutionTrigger.RETRY, now);
            successor.setAttempt(entry.getAttempt() + 1);
            Optional<ExecutionLog> next = store.openRetry(entry.getId(), closing, successor, notBefore);
            if (next.isPresent()) {
                log.warn("Execution log={} task={} attempt={} failed ({}): {}; retry log={} at {}", entry.getId(),
                        entry.getTaskName(), entry.getAttempt(), kind, closing.getErrorMessage(), next.get().getId(), notBefore);
            } else {
                log.info("Execution log={} is no longer RUNNING, retry not scheduled", entry.getId());
            }
            return;
        }

        if (store.transitionExecutionLog(entry.getId(), ExecutionStatus.RUNNING, ExecutionStatus.FAILED, closing)) {
            store.recordOutcome(entry.getJobId(), false);
            log.error("Execution log={} task={} attempt={} failed ({}), giving up", entry.getId(),
                    entry.getTaskName(), entry.getAttempt(), kind, error);
        } else {
            log.info("Execution log={} is no longer RUNNING, failure not recorded", entry.getId());
        }
    }

    // 未知任务 / 参数非法：不启动，也不重试
    private void failBeforeStart(ExecutionLog entry, RuntimeException error) {
        ErrorKind kind = ErrorKind.of(error);
        LogUpdate update = LogUpdate.failure(clock.instant(), kind, error.getMessage());
        if (store.transitionExecutionLog(entry.getId(), ExecutionStatus.PENDING, ExecutionStatus.FAILED, update)) {
            store.recordOutcome(entry.getJobId(), false);
            log.warn("Execution log={} task={} rejected ({}): {}", entry.getId(), entry.getTaskName(), kind, error.getMessage());
        }
    }

    // ------------------------------------------------------------------ cancel / sweep

    /**
     * PENDING / RUNNING -> CANCELLED. 本节点上的任务体会被中断；其他节点由 sweep 发现并中断。
     *
     * @return false when the execution had already reached a terminal status
     */
    public boolean cancel(Long logId) {
        ExecutionLog entry = store.findLog(logId).orElseThrow(() -> new ExecutionNotFoundException(logId));
        if (entry.getStatus().isTerminal()) {
            return false;
        }
        LogUpdate update = LogUpdate.builder()
                .finishedAt(clock.instant())
                .errorKind(ErrorKind.CANCELLED)
                .errorMessage("Cancelled")
                .build();
        boolean ok = store.transitionExecutionLog(logId, entry.getStatus(), ExecutionStatus.CANCELLED, update);
        if (!ok && entry.getStatus() == ExecutionStatus.PENDING) {
            // 与 worker 的 PENDING -> RUNNING 竞争
            ok = store.transitionExecutionLog(logId, ExecutionStatus.RUNNING, ExecutionStatus.CANCELLED, update);
        }
        if (ok) {
            interruptIfRunning(logId);
            log.info("Execution log={} cancelled", logId);
        }
        return ok;
    }

    /**
     * 周期性维护：续租本节点持有的请求，中断在其他节点被取消的任务，回收租约过期的请求。
     */
    public void sweep() {
        Instant now = clock.instant();
        if (!running.isEmpty()) {
            List<Long> requestIds = new ArrayList<>();
            for (RunningExecution r : running.values()) requestIds.add(r.requestId);
            queue.heartbeat(requestIds, now);

            Map<Long, ExecutionStatus> statuses = store.findStatuses(new ArrayList<>(running.keySet()));
            for (Map.Entry<Long, ExecutionStatus> e : statuses.entrySet()) {
                if (e.getValue() == ExecutionStatus.CANCELLED && interruptIfRunning(e.getKey())) {
                    log.info("Interrupted execution log={} cancelled elsewhere", e.getKey());
                }
            }
        }
        queue.requeueExpired(now.minusMillis(props.getDispatcher().getLeaseMs()));
    }

    public boolean interruptIfRunning(Long logId) {
        RunningExecution r = running.get(logId);
        if (r == null) return false;
        r.context.cancel();
        return r.future.cancel(true);
    }

    public boolean isRunning(Long logId) {
        return running.containsKey(logId);
    }

    public int availableSlots() {
        return slots.availablePermits();
    }

    public String getOwner() {
        return owner;
    }

    // ------------------------------------------------------------------ helpers

    private JsonNode parseParameters(ExecutionLog entry) {
        String json = entry.getParameters();
        if (json == null || json.trim().isEmpty()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ParameterValidationException(entry.getTaskName(),
                    Collections.singletonList("Parameters are not valid JSON: " + e.getOriginalMessage()));
        }
    }

    private static ExecutionLog newLog(Long jobId, String taskName, String parametersJson, ExecutionTrigger trigger, Instant now) {
        ExecutionLog l = new ExecutionLog();
        l.setJobId(jobId);
        l.setTaskName(taskName);
        l.setParameters(parametersJson == null || parametersJson.trim().isEmpty() ? "{}" : parametersJson);
        l.setStatus(ExecutionStatus.PENDING);
        l.setTrigger(trigger);
        l.setAttempt(1);
        l.setCreatedAt(Timestamp.from(now));
        return l;
    }

    private void acknowledgeQuietly(Long requestId) {
        try {
            queue.acknowledge(requestId);
        } catch (StoreUnavailableException e) {
            log.warn("Cannot acknowledge request={}, it will be redelivered after its lease: {}", requestId, e.getMessage());
        }
    }

    private static String describe(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.trim().isEmpty()) ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + m;
    }

    // 写入 execution_log.owner / execution_request.owner；未配置时用 host:pid
    static String resolveOwner(String configured) {
        if (StringUtils.hasText(configured)) {
            return configured.trim();
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local host name, worker owner falls back to 'localhost': {}", e.getMessage());
            host = "localhost";
        }
        return host + ":" + ProcessHandle.current().pid();
    }

    private static final class RunningExecution {
        private final Long requestId;
        private final TaskContext context;
        private final Future<?> future;

        private RunningExecution(Long requestId, TaskContext context, Future<?> future) {
            this.requestId = requestId;
            this.context = context;
            this.future = future;
        }
    }
}
