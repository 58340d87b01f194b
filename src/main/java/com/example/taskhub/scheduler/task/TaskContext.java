package com.example.taskhub.scheduler.task;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;

@Getter
public class TaskContext {

    private final Long logId;
    private final Long jobId;
    private final int attempt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public TaskContext(Long logId, Long jobId, int attempt) {
        this.logId = logId;
        this.jobId = jobId;
        this.attempt = attempt;
    }

    /**
     * 取消 / 超时信号（best-effort，由 Dispatcher 设置并同时中断线程）
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled() throws InterruptedException {
        if (isCancelled()) {
            throw new InterruptedException("Execution " + logId + " cancelled");
        }
    }
}
