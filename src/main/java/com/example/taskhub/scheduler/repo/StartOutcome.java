package com.example.taskhub.scheduler.repo;

public enum StartOutcome {
    STARTED,     // PENDING -> RUNNING 成功
    BUSY,        // QUEUE：同一 job 已有 RUNNING 的 log，稍后再试
    NOT_PENDING  // log 已不是 PENDING（被取消 / 已处理 / 不存在）
}
