package com.example.taskhub.scheduler.repo;

import com.example.taskhub.scheduler.domain.ExecutionLog;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Result of {@link JobStore#claimAndOpen}.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class FiringOutcome {

    public enum Status {
        CONFLICT,  // 其他实例已领取该次触发，或 job 已不是 ACTIVE
        SKIPPED,   // 已领取，但 SKIP_IF_RUNNING 且有 open log
        OPENED     // 已领取并入队
    }

    private final Status status;
    private final ExecutionLog log;

    public static FiringOutcome conflict() {
        return new FiringOutcome(Status.CONFLICT, null);
    }

    public static FiringOutcome skipped() {
        return new FiringOutcome(Status.SKIPPED, null);
    }

    public static FiringOutcome opened(ExecutionLog log) {
        return new FiringOutcome(Status.OPENED, log);
    }

    public boolean isClaimed() {
        return status != Status.CONFLICT;
    }

    public Optional<ExecutionLog> opened() {
        return Optional.ofNullable(log);
    }
}
