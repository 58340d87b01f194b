package com.example.taskhub.scheduler.service;

import com.example.taskhub.scheduler.domain.ConcurrencyPolicy;
import com.example.taskhub.scheduler.domain.TriggerState;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import javax.validation.groups.Default;

/**
 * Job definition for create and update. On update a null field keeps the current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDefinition {

    /** Constraints that only apply when a job is created. */
    public interface Create extends Default {
    }

    @NotBlank(groups = Create.class)
    @Size(max = 64)
    private String taskName;

    @Size(max = 255)
    private String description;

    @NotBlank(groups = Create.class)
    @Size(max = 64)
    private String cronExpression;

    private JsonNode parameters;

    private ConcurrencyPolicy concurrencyPolicy;

    private TriggerState triggerState;

    @Min(1)
    private Integer maxExecutions;

    @Min(1)
    private Integer maxFailures;
}
