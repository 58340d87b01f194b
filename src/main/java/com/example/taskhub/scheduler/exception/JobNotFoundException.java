package com.example.taskhub.scheduler.exception;

public class JobNotFoundException extends SchedulerException {

    public JobNotFoundException(Long jobId) {
        super("Scheduled job not found: id=" + jobId);
    }
}
