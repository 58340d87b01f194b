package com.example.taskhub.scheduler.web.dto;

import com.example.taskhub.scheduler.domain.ConcurrencyPolicy;
import com.example.taskhub.scheduler.domain.ScheduledJob;
import com.example.taskhub.scheduler.domain.TriggerState;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.sql.Timestamp;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {
    private Long id;
    private String taskName;
    private String description;
    private String cronExpression;
    private JsonNode parameters;
    private TriggerState triggerState;
    private ConcurrencyPolicy concurrencyPolicy;
    private Instant nextFireAt;
    private Instant lastFireAt;
    private int executionCount;
    private int consecutiveFailures;
    private Integer maxExecutions;
    private Integer maxFailures;
    /**
     * Cron firings are no longer enqueued once the job is exhausted.
     */
    private boolean exhausted;
    private boolean archived;
    private Instant createdAt;
    private Instant updatedAt;

    public static JobResponse from(ScheduledJob job, JsonNode parameters) {
        return JobResponse.builder()
                .id(job.getId())
                .taskName(job.getTaskName())
                .description(job.getDescription())
                .cronExpression(job.getCronExpression())
                .parameters(parameters)
                .triggerState(job.getTriggerState())
                .concurrencyPolicy(job.getConcurrencyPolicy())
                .nextFireAt(toInstant(job.getNextFireAt()))
                .lastFireAt(toInstant(job.getLastFireAt()))
                .executionCount(job.getExecutionCount() == null ? 0 : job.getExecutionCount())
                .consecutiveFailures(job.getConsecutiveFailures() == null ? 0 : job.getConsecutiveFailures())
                .maxExecutions(job.getMaxExecutions())
                .maxFailures(job.getMaxFailures())
                .exhausted(job.isExhausted())
                .archived(job.isArchived())
                .createdAt(toInstant(job.getCreatedAt()))
                .updatedAt(toInstant(job.getUpdatedAt()))
                .build();
    }

    static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
