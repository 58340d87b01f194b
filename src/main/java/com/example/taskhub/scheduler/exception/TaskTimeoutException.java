package com.example.taskhub.scheduler.exception;

import java.time.Duration;

public class TaskTimeoutException extends SchedulerException {

    public TaskTimeoutException(String taskName, Duration timeout) {
        super("Task '" + taskName + "' did not finish within " + timeout.toMillis() + " ms");
    }
}
