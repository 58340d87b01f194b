package com.example.taskhub.scheduler.exception;

public class TaskExecutionException extends SchedulerException {

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
