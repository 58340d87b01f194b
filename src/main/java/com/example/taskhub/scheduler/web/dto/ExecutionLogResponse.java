package com.example.taskhub.scheduler.web.dto;

import com.example.taskhub.scheduler.domain.ErrorKind;
import com.example.taskhub.scheduler.domain.ExecutionLog;
import com.example.taskhub.scheduler.domain.ExecutionStatus;
import com.example.taskhub.scheduler.domain.ExecutionTrigger;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for execution log queries
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionLogResponse {
    private Long id;
    private Long jobId;
    private String taskName;
    private JsonNode parameters;
    private ExecutionStatus status;
    private ExecutionTrigger trigger;
    private int attempt;
    private Long previousLogId;
    private String owner;
    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;
    private Long durationMs;

    /**
     * Task result (if succeeded)
     */
    private JsonNode result;

    private ErrorKind errorKind;
    private String errorMessage;

    public static ExecutionLogResponse from(ExecutionLog log, JsonNode parameters, JsonNode result) {
        return ExecutionLogResponse.builder()
                .id(log.getId())
                .jobId(log.getJobId())
                .taskName(log.getTaskName())
                .parameters(parameters)
                .status(log.getStatus())
                .trigger(log.getTrigger())
                .attempt(log.getAttempt() == null ? 1 : log.getAttempt())
                .previousLogId(log.getPreviousLogId())
                .owner(log.getOwner())
                .createdAt(JobResponse.toInstant(log.getCreatedAt()))
                .startedAt(JobResponse.toInstant(log.getStartedAt()))
                .finishedAt(JobResponse.toInstant(log.getFinishedAt()))
                .durationMs(log.getDurationMs())
                .result(result)
                .errorKind(log.getErrorKind())
                .errorMessage(log.getErrorMessage())
                .build();
    }
}
