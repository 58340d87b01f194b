package com.example.taskhub.scheduler.web;

import com.example.taskhub.scheduler.domain.ExecutionLog;
import com.example.taskhub.scheduler.domain.ExecutionStatus;
import com.example.taskhub.scheduler.domain.ScheduledJob;
import com.example.taskhub.scheduler.repo.JobStatistics;
import com.example.taskhub.scheduler.service.CronPreview;
import com.example.taskhub.scheduler.service.JobDefinition;
import com.example.taskhub.scheduler.service.JobService;
import com.example.taskhub.scheduler.web.dto.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON API for jobs, executions and the task catalog.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;
    private final ObjectMapper mapper;

    // ---- jobs ----

    @PostMapping("/jobs")
    public ResponseEntity<JobResponse> createJob(@Validated(JobDefinition.Create.class) @RequestBody JobDefinition def) {
        ScheduledJob job = jobService.createJob(def);
        return ResponseEntity.created(URI.create("/api/jobs/" + job.getId())).body(toResponse(job));
    }

    @GetMapping("/jobs")
    public List<JobResponse> listJobs(@RequestParam(value = "includeArchived", defaultValue = "false") boolean includeArchived) {
        return jobService.listJobs(includeArchived).stream().map(this::toResponse).collect(Collectors.toList());
    }

    @GetMapping("/jobs/statistics")
    public JobStatistics statistics() {
        return jobService.statistics();
    }

    @GetMapping("/jobs/{id}")
    public JobResponse getJob(@PathVariable Long id) {
        return toResponse(jobService.getJob(id));
    }

    @PutMapping("/jobs/{id}")
    public JobResponse updateJob(@PathVariable Long id, @Valid @RequestBody JobDefinition def) {
        return toResponse(jobService.updateJob(id, def));
    }

    @PostMapping("/jobs/{id}/pause")
    public JobResponse pauseJob(@PathVariable Long id) {
        return toResponse(jobService.pauseJob(id));
    }

    @PostMapping("/jobs/{id}/resume")
    public JobResponse resumeJob(@PathVariable Long id) {
        return toResponse(jobService.resumeJob(id));
    }

    @DeleteMapping("/jobs/{id}")
    public JobResponse archiveJob(@PathVariable Long id) {
        return toResponse(jobService.archiveJob(id));
    }

    @PostMapping("/jobs/{id}/execute")
    public ResponseEntity<ExecutionLogResponse> executeNow(@PathVariable Long id,
                                                           @RequestBody(required = false) ExecuteNowRequest request) {
        JsonNode overrides = request == null ? null : request.getParameters();
        boolean force = request != null && request.isForce();
        ExecutionLog entry = jobService.executeNow(id, overrides, force);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/executions/" + entry.getId()))
                .body(toResponse(entry));
    }

    @GetMapping("/jobs/{id}/executions")
    public List<ExecutionLogResponse> listJobExecutions(@PathVariable Long id,
                                                        @RequestParam(value = "status", required = false) ExecutionStatus status,
                                                        @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return toResponses(jobService.listExecutionLogs(id, status, limit));
    }

    // ---- executions ----

    @GetMapping("/executions")
    public List<ExecutionLogResponse> listExecutions(@RequestParam(value = "jobId", required = false) Long jobId,
                                                     @RequestParam(value = "status", required = false) ExecutionStatus status,
                                                     @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return toResponses(jobService.listExecutionLogs(jobId, status, limit));
    }

    @GetMapping("/executions/{id}")
    public ExecutionLogResponse getExecution(@PathVariable Long id) {
        return toResponse(jobService.getExecutionLog(id));
    }

    @PostMapping("/executions/{id}/cancel")
    public ExecutionLogResponse cancelExecution(@PathVariable Long id) {
        return toResponse(jobService.cancelExecution(id));
    }

    // ---- tasks / cron ----

    @GetMapping("/tasks")
    public List<TaskResponse> listTasks() {
        return jobService.listTasks().stream().map(TaskResponse::from).collect(Collectors.toList());
    }

    @PostMapping("/tasks/run")
    public ResponseEntity<ExecutionLogResponse> runTask(@Valid @RequestBody RunTaskRequest request) {
        ExecutionLog entry = jobService.runTask(request.getTaskName(), request.getParameters());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/executions/" + entry.getId()))
                .body(toResponse(entry));
    }

    @GetMapping("/cron/preview")
    public CronPreview previewCron(@RequestParam("expression") String expression,
                                   @RequestParam(value = "count", defaultValue = "5") int count) {
        return jobService.previewCron(expression, count);
    }

    // ---- mapping ----

    private JobResponse toResponse(ScheduledJob job) {
        return JobResponse.from(job, readJson(job.getParameters()));
    }

    private ExecutionLogResponse toResponse(ExecutionLog entry) {
        return ExecutionLogResponse.from(entry, readJson(entry.getParameters()), readJson(entry.getResult()));
    }

    private List<ExecutionLogResponse> toResponses(List<ExecutionLog> logs) {
        return logs.stream().map(this::toResponse).collect(Collectors.toList());
    }

    private JsonNode readJson(String json) {
        if (json == null || json.trim().isEmpty()) return null;
        try {
            // 保留存储文本里的小数位（例如金额 10.00）
            return mapper.reader()
                    .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                    .with(JsonNodeFactory.withExactBigDecimals(true))
                    .readTree(json);
        } catch (JsonProcessingException e) {
            // 历史数据不是合法 JSON 时按原文返回
            log.debug("Stored value is not JSON, returning as text: {}", e.getOriginalMessage());
            return mapper.getNodeFactory().textNode(json);
        }
    }
}
