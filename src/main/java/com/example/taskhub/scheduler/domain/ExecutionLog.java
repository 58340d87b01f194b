package com.example.taskhub.scheduler.domain;

import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

/**
 * One attempt of one execution. Retries form a chain through {@code previousLogId}.
 */
@Entity
@Getter @Setter @ToString
@Table(name = "execution_log", indexes = {
        @Index(name = "idx_log_job_status", columnList = "job_id, status"),
        @Index(name = "idx_log_previous", columnList = "previous_log_id")})
public class ExecutionLog {
    public static final int ERROR_MESSAGE_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // null: 未绑定 job 的临时执行
    @Column(name = "job_id")
    private Long jobId;

    @Column(name = "task_name", length = 64, nullable = false)
    private String taskName;

    @Lob
    @Column(name = "parameters")
    private String parameters;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ExecutionStatus status = ExecutionStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 16)
    private ExecutionTrigger trigger = ExecutionTrigger.CRON;

    @Column(name = "attempt", nullable = false)
    private Integer attempt = 1;

    @Column(name = "previous_log_id")
    private Long previousLogId;

    @Column(name = "owner", length = 128)
    private String owner;

    @Column(name = "created_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    @Column(name = "started_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp startedAt;

    @Column(name = "finished_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp finishedAt;

    @Lob
    @Column(name = "result")
    private String result;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 24)
    private ErrorKind errorKind;

    @Column(name = "error_message", length = ERROR_MESSAGE_LENGTH)
    private String errorMessage;

    // 结束时写入，统计平均耗时用
    @Column(name = "duration_ms")
    private Long durationMs;

    public Long getDurationMs() {
        if (durationMs != null) return durationMs;
        if (startedAt == null || finishedAt == null) return null;
        return finishedAt.getTime() - startedAt.getTime();
    }

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = new Timestamp(System.currentTimeMillis());
    }
}
