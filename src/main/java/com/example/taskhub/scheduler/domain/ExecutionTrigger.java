package com.example.taskhub.scheduler.domain;

public enum ExecutionTrigger {
    CRON,
    MANUAL,
    RETRY
}
