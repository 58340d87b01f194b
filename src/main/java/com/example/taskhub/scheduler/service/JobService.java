package com.example.taskhub.scheduler.service;

import com.example.taskhub.scheduler.domain.*;
import com.example.taskhub.scheduler.exception.*;
import com.example.taskhub.scheduler.repo.JobStatistics;
import com.example.taskhub.scheduler.repo.JobStore;
import com.example.taskhub.scheduler.task.BoundParameters;
import com.example.taskhub.scheduler.task.TaskDescriptor;
import com.example.taskhub.scheduler.task.TaskRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Job management operations behind the REST API. Safe to call while a tick is running: writes to a
 * job go through {@link JobStore#modifyJob}, which holds the job row lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobService {

    static final int MAX_LOG_PAGE = 500;
    static final int MAX_PREVIEW = 50;

    private final JobStore store;
    private final TaskRegistry registry;
    private final CronEvaluator cron;
    private final Dispatcher dispatcher;
    private final ObjectMapper mapper;
    private final Clock clock;

    public ScheduledJob createJob(JobDefinition def) {
        if (!StringUtils.hasText(def.getTaskName())) {
            throw new IllegalArgumentException("taskName is required");
        }
        if (!StringUtils.hasText(def.getCronExpression())) {
            throw new IllegalArgumentException("cronExpression is required");
        }
        TaskDescriptor descriptor = registry.resolve(def.getTaskName());
        String expr = def.getCronExpression().trim();
        Instant now = clock.instant();
        Instant next = cron.nextFireTime(expr, now);
        BoundParameters bound = registry.validate(descriptor, def.getParameters());

        ScheduledJob job = new ScheduledJob();
        job.setTaskName(descriptor.getName());
        job.setDescription(def.getDescription());
        job.setCronExpression(expr);
        job.setParameters(bound.toJson().toString());
        job.setTriggerState(def.getTriggerState() != null ? def.getTriggerState() : TriggerState.ACTIVE);
        if (def.getConcurrencyPolicy() != null) job.setConcurrencyPolicy(def.getConcurrencyPolicy());
        job.setMaxExecutions(def.getMaxExecutions());
        if (def.getMaxFailures() != null) job.setMaxFailures(def.getMaxFailures());
        job.setNextFireAt(Timestamp.from(next));

        ScheduledJob saved = store.saveJob(job);
        log.info("Job created id={} task={} cron={} next={}", saved.getId(), saved.getTaskName(), expr, next);
        return saved;
    }

    public ScheduledJob updateJob(Long jobId, JobDefinition def) {
        ScheduledJob current = getJob(jobId);
        requireNotArchived(current);

        String taskName = StringUtils.hasText(def.getTaskName()) ? def.getTaskName().trim() : current.getTaskName();
        TaskDescriptor descriptor = registry.resolve(taskName);
        JsonNode params = def.getParameters() != null ? def.getParameters() : readParameters(current);
        String boundJson = registry.validate(descriptor, params).toJson().toString();

        String expr = StringUtils.hasText(def.getCronExpression()) ? def.getCronExpression().trim() : current.getCronExpression();
        Instant now = clock.instant();
        Instant next = cron.nextFireTime(expr, now);

        ScheduledJob updated = store.modifyJob(jobId, job -> {
            requireNotArchived(job);
            boolean cronChanged = !expr.equals(job.getCronExpression());
            job.setTaskName(taskName);
            job.setParameters(boundJson);
            job.setCronExpression(expr);
            if (def.getDescription() != null) job.setDescription(def.getDescription());
            if (def.getConcurrencyPolicy() != null) job.setConcurrencyPolicy(def.getConcurrencyPolicy());
            if (def.getMaxExecutions() != null) job.setMaxExecutions(def.getMaxExecutions());
            if (def.getMaxFailures() != null) job.setMaxFailures(def.getMaxFailures());

            TriggerState target = def.getTriggerState() != null ? def.getTriggerState() : job.getTriggerState();
            boolean resumed = target == TriggerState.ACTIVE && job.getTriggerState() == TriggerState.PAUSED;
            job.setTriggerState(target);
            if (resumed) {
                job.setConsecutiveFailures(0);
            }
            // cron 变更或恢复时从 now 重新计算；暂停时 next_fire_at 保持不变
            if (target == TriggerState.ACTIVE && (cronChanged || resumed)) {
                job.setNextFireAt(Timestamp.from(next));
            }
        });
        log.info("Job updated id={} task={} cron={} state={}", jobId, updated.getTaskName(),
                updated.getCronExpression(), updated.getTriggerState());
        return updated;
    }

    public ScheduledJob pauseJob(Long jobId) {
        ScheduledJob job = store.modifyJob(jobId, j -> {
            requireNotArchived(j);
            j.setTriggerState(TriggerState.PAUSED);
        });
        log.info("Job paused id={}", jobId);
        return job;
    }

    public ScheduledJob resumeJob(Long jobId) {
        Instant now = clock.instant();
        ScheduledJob job = store.modifyJob(jobId, j -> {
            requireNotArchived(j);
            j.setTriggerState(TriggerState.ACTIVE);
            j.setConsecutiveFailures(0);
            j.setNextFireAt(Timestamp.from(cron.nextFireTime(j.getCronExpression(), now)));
        });
        log.info("Job resumed id={} next={}", jobId, job.getNextFireAt());
        return job;
    }

    /**
     * Archive is the delete operation: the job stops firing and disappears from the default listing,
     * its history stays.
     */
    public ScheduledJob archiveJob(Long jobId) {
        ScheduledJob job = store.modifyJob(jobId, j -> {
            j.setArchived(true);
            j.setTriggerState(TriggerState.PAUSED);
        });
        log.info("Job archived id={}", jobId);
        return job;
    }

    /**
     * Runs the job once, now, regardless of its cron and trigger state. {@code overrides} are merged
     * over the job's parameters for this execution only.
     *
     * @throws IllegalJobStateException when the job is SKIP_IF_RUNNING, has an open execution and
     *                                  {@code force} is false
     */
    public ExecutionLog executeNow(Long jobId, JsonNode overrides, boolean force) {
        ScheduledJob job = getJob(jobId);
        requireNotArchived(job);
        TaskDescriptor descriptor = registry.resolve(job.getTaskName());

        ObjectNode merged = readParameters(job);
        if (overrides != null && !overrides.isNull()) {
            if (!overrides.isObject()) {
                throw new ParameterValidationException(job.getTaskName(),
                        Collections.singletonList("Parameter overrides must be a JSON object"));
            }
            Iterator<String> names = overrides.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                merged.set(name, overrides.get(name));
            }
        }
        BoundParameters bound = registry.validate(descriptor, merged);

        Optional<ExecutionLog> opened = dispatcher.dispatch(job, ExecutionTrigger.MANUAL, bound.toJson().toString(), force);
        if (!opened.isPresent()) {
            throw new IllegalJobStateException("Job " + jobId + " already has an open execution; use force to run anyway");
        }
        log.info("Manual execution of job id={} enqueued as log={} (force={})", jobId, opened.get().getId(), force);
        return opened.get();
    }

    /**
     * One-off execution of a task without a job.
     */
    public ExecutionLog runTask(String taskName, JsonNode parameters) {
        TaskDescriptor descriptor = registry.resolve(taskName);
        BoundParameters bound = registry.validate(descriptor, parameters);
        return dispatcher.dispatchAdHoc(descriptor.getName(), bound.toJson().toString());
    }

    public ExecutionLog cancelExecution(Long logId) {
        if (!dispatcher.cancel(logId)) {
            ExecutionLog current = getExecutionLog(logId);
            throw new IllegalJobStateException("Execution " + logId + " already finished as " + current.getStatus());
        }
        return getExecutionLog(logId);
    }

    public ScheduledJob getJob(Long jobId) {
        return store.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<ScheduledJob> listJobs(boolean includeArchived) {
        return store.listJobs(includeArchived);
    }

    public List<ExecutionLog> listExecutionLogs(Long jobId, int limit) {
        return listExecutionLogs(jobId, null, limit);
    }

    /**
     * @param status only logs currently in this status; null for all
     */
    public List<ExecutionLog> listExecutionLogs(Long jobId, ExecutionStatus status, int limit) {
        if (jobId != null) {
            getJob(jobId);
        }
        int size = Math.min(Math.max(1, limit), MAX_LOG_PAGE);
        return store.listExecutionLogs(jobId, status, size);
    }

    public JobStatistics statistics() {
        return store.statistics();
    }

    public ExecutionLog getExecutionLog(Long logId) {
        return store.findLog(logId).orElseThrow(() -> new ExecutionNotFoundException(logId));
    }

    public List<TaskDescriptor> listTasks() {
        return registry.all();
    }

    public CronPreview previewCron(String expression, int count) {
        Instant now = clock.instant();
        int n = Math.min(Math.max(1, count), MAX_PREVIEW);
        return CronPreview.builder()
                .expression(expression)
                .description(cron.describe(expression))
                .zone(cron.getZone().getId())
                .nextFireTimes(cron.nextFireTimes(expression, now, n))
                .build();
    }

    private ObjectNode readParameters(ScheduledJob job) {
        String json = job.getParameters();
        if (!StringUtils.hasText(json)) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode node = mapper.readTree(json);
            return node.isObject() ? (ObjectNode) node : mapper.createObjectNode();
        } catch (JsonProcessingException e) {
            throw new ParameterValidationException(job.getTaskName(),
                    Collections.singletonList("Stored parameters are not valid JSON: " + e.getOriginalMessage()));
        }
    }

    private static void requireNotArchived(ScheduledJob job) {
        if (job.isArchived()) {
            throw new IllegalJobStateException("Job " + job.getId() + " is archived");
        }
    }
}
