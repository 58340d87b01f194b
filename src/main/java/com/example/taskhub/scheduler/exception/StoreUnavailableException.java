package com.example.taskhub.scheduler.exception;

public class StoreUnavailableException extends SchedulerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
