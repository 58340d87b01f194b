package com.example.taskhub.scheduler.domain;

public enum TriggerState {
    ACTIVE,  // 参与 cron 轮询
    PAUSED   // 暂停：next_fire_at 保持旧值，恢复时从 now 重新计算
}
