package com.example.taskhub.scheduler.domain;

/**
 * What happens when a job fires while an earlier execution of it is still open.
 */
public enum ConcurrencyPolicy {
    SKIP_IF_RUNNING, // 有未结束的执行则跳过本次触发
    ALLOW_OVERLAP,   // 总是入队，允许并行
    QUEUE            // 入队，但 Dispatcher 按 job 串行执行
}
