package com.example.taskhub.scheduler.exception;

import lombok.Getter;

@Getter
public class UnknownTaskException extends SchedulerException {

    private final String taskName;

    public UnknownTaskException(String taskName) {
        super("No task registered under name '" + taskName + "'");
        this.taskName = taskName;
    }
}
