package com.example.taskhub.scheduler.domain;

import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

@Entity
@Getter @Setter @ToString
@Table(name = "scheduled_job", indexes = {
        @Index(name = "idx_job_due", columnList = "trigger_state, archived, next_fire_at"),
        @Index(name = "idx_job_task", columnList = "task_name")})
public class ScheduledJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "task_name", length = 64, nullable = false)
    private String taskName;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "cron_expression", length = 64, nullable = false)
    private String cronExpression;

    /** bound parameters as a JSON object */
    @Lob
    @Column(name = "parameters")
    private String parameters;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_state", nullable = false, length = 16)
    private TriggerState triggerState = TriggerState.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "concurrency_policy", nullable = false, length = 24)
    private ConcurrencyPolicy concurrencyPolicy = ConcurrencyPolicy.SKIP_IF_RUNNING;

    // 只允许通过 tryClaim（条件更新）推进
    @Column(name = "next_fire_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp nextFireAt;

    @Column(name = "last_fire_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp lastFireAt;

    @Column(name = "execution_count", nullable = false)
    private Integer executionCount = 0;

    @Column(name = "consecutive_failures", nullable = false)
    private Integer consecutiveFailures = 0;

    @Column(name = "max_executions")
    private Integer maxExecutions;

    @Column(name = "max_failures", nullable = false)
    private Integer maxFailures = 3;

    @Column(name = "archived", nullable = false)
    private Boolean archived = false;

    @Column(name = "created_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    @Column(name = "updated_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp updatedAt;

    /**
     * 达到 max_executions 或连续失败次数达到 max_failures 后，cron 触发不再入队（手动执行不受影响）。
     */
    public boolean isExhausted() {
        if (maxExecutions != null && executionCount != null && executionCount >= maxExecutions) return true;
        return maxFailures != null && consecutiveFailures != null && consecutiveFailures >= maxFailures;
    }

    public boolean isArchived() {
        return Boolean.TRUE.equals(archived);
    }

    @PrePersist
    public void prePersist() {
        Timestamp now = new Timestamp(System.currentTimeMillis());
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = new Timestamp(System.currentTimeMillis());
    }
}
