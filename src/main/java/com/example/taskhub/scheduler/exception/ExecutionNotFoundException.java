package com.example.taskhub.scheduler.exception;

public class ExecutionNotFoundException extends SchedulerException {

    public ExecutionNotFoundException(Long logId) {
        super("Execution log not found: id=" + logId);
    }
}
