package com.example.taskhub.scheduler.exception;

public class IllegalJobStateException extends SchedulerException {

    public IllegalJobStateException(String message) {
        super(message);
    }
}
