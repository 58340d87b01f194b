package com.example.taskhub.scheduler.domain;

import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

/**
 * Durable queue entry pointing at a PENDING {@link ExecutionLog}. Retry delays are expressed
 * through {@code notBefore}; a claimed entry whose heartbeat lapses is made READY again.
 */
@Entity
@Getter @Setter @ToString
@Table(name = "execution_request", indexes = {
        @Index(name = "idx_request_pick", columnList = "status, not_before, id"),
        @Index(name = "idx_request_log", columnList = "log_id")})
public class ExecutionRequest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "log_id", nullable = false)
    private Long logId;

    @Column(name = "job_id")
    private Long jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RequestStatus status = RequestStatus.READY;

    @Column(name = "not_before", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp notBefore;

    @Column(name = "owner", length = 128)
    private String owner;

    @Column(name = "heartbeat_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp heartbeatAt;

    @Column(name = "created_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = new Timestamp(System.currentTimeMillis());
    }
}
