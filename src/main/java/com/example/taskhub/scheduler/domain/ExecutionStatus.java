package com.example.taskhub.scheduler.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public enum ExecutionStatus {
    PENDING,    // 已入队，等待 worker
    RUNNING,    // 执行中
    SUCCEEDED,  // 成功（终态）
    FAILED,     // 失败（终态，不再重试）
    RETRYING,   // 本次 attempt 失败，已生成下一次 attempt（对本 attempt 是终态）
    CANCELLED;  // 已取消（终态，不重试）

    /**
     * Statuses that make an execution "open" for concurrency checks. A retrying chain stays open
     * through the PENDING successor created together with the RETRYING row.
     */
    public static final List<ExecutionStatus> OPEN = Collections.unmodifiableList(Arrays.asList(PENDING, RUNNING));

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        return allowedNext().contains(next);
    }

    private Set<ExecutionStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(RUNNING, FAILED, CANCELLED);
            case RUNNING:
                return EnumSet.of(SUCCEEDED, FAILED, RETRYING, CANCELLED);
            default:
                return EnumSet.noneOf(ExecutionStatus.class);
        }
    }
}
